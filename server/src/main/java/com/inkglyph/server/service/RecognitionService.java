package com.inkglyph.server.service;

import com.inkglyph.server.ai.CaptureResult;
import com.inkglyph.server.ai.GlyphRecognizer;
import com.inkglyph.server.ai.InitializationException;
import com.inkglyph.server.ai.InkCapture;
import com.inkglyph.server.ai.NotInitializedException;
import com.inkglyph.server.ai.inference.InferenceEngine;
import com.inkglyph.server.ai.inference.InferenceEngineFactory;
import com.inkglyph.server.ai.labels.LabelFileReader;
import com.inkglyph.server.ai.labels.LabelTable;
import com.inkglyph.server.ai.ranking.RecognitionResult;
import com.inkglyph.server.config.RecognizerConfig;
import com.inkglyph.server.config.RecognizerSettings;
import com.inkglyph.server.ink.SessionSnapshot;
import com.inkglyph.server.util.DataPathResolver;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs recognitions off the request thread. Every request gets a sequence
 * number; callers use it to drop results that complete after a newer one.
 */
@Service
public class RecognitionService {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionService.class);

    private final RecognizerConfig.ConfigRoot config;
    private final RecognizerSettings settings;
    private final InkCapture capture;
    private final GlyphRecognizer recognizer;

    private final AtomicLong sequence = new AtomicLong();
    private final ExecutorService workers;
    private volatile String initError;

    public RecognitionService(RecognizerConfig.ConfigRoot config, RecognizerSettings settings, InkCapture capture,
            GlyphRecognizer recognizer) {
        this.config = config;
        this.settings = settings;
        this.capture = capture;
        this.recognizer = recognizer;
        AtomicInteger threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads, r -> {
            Thread t = new Thread(r, "recognizer-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        new Thread(() -> {
            try {
                logger.info("Initializing recognizer...");
                LabelTable labels = LabelFileReader
                        .read(Path.of(DataPathResolver.resolve(config, settings.labelsFile)));
                InferenceEngine engine = InferenceEngineFactory.create(settings, config);
                initialize(labels, engine);
            } catch (InitializationException e) {
                initError = e.getMessage();
                logger.error("Recognizer initialization failed", e);
            } catch (Exception e) {
                initError = e.getClass().getSimpleName() + ": " + e.getMessage();
                logger.error("Unexpected error during recognizer initialization", e);
            }
        }, "recognizer-init").start();
    }

    public void initialize(LabelTable labels, InferenceEngine engine) {
        recognizer.initialize(labels, engine);
        initError = null;
    }

    public boolean isReady() {
        return recognizer.isInitialized();
    }

    public String getInitError() {
        return initError;
    }

    public CaptureResult capture(SessionSnapshot snapshot) {
        return capture.capture(snapshot);
    }

    /**
     * Queues a recognition of the snapshot.
     *
     * @throws NotInitializedException immediately when the recognizer is not
     *                                 ready
     */
    public CompletableFuture<RecognitionOutcome> submit(SessionSnapshot snapshot) {
        if (!isReady()) {
            throw new NotInitializedException("Recognizer not initialized");
        }
        long seq = sequence.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> run(seq, snapshot), workers);
    }

    /**
     * Same as {@link #submit} but on the caller's thread.
     */
    public RecognitionOutcome recognize(SessionSnapshot snapshot) {
        return run(sequence.incrementAndGet(), snapshot);
    }

    private RecognitionOutcome run(long seq, SessionSnapshot snapshot) {
        long start = System.nanoTime();
        CaptureResult captured = capture.capture(snapshot);
        if (captured.isEmpty()) {
            logger.debug("Request #{}: nothing to recognize", seq);
            return RecognitionOutcome.empty(seq, snapshot.getRevision());
        }
        List<RecognitionResult> results = recognizer.recognize(captured.getRaster());
        logger.info("Request #{} recognized in {} ms: {}", seq,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), results);
        return new RecognitionOutcome(seq, snapshot.getRevision(), RecognitionOutcome.Status.OK, results,
                captured.getRaster());
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
