package com.inkglyph.server.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inkglyph.server.ai.CaptureResult;
import com.inkglyph.server.ai.GlyphRecognizer;
import com.inkglyph.server.ai.InkCapture;
import com.inkglyph.server.ai.RecognitionException;
import com.inkglyph.server.ai.inference.InferenceEngineFactory;
import com.inkglyph.server.ai.labels.LabelFileReader;
import com.inkglyph.server.ai.ranking.RecognitionResult;
import com.inkglyph.server.config.RecognizerConfig;
import com.inkglyph.server.config.RecognizerConfiguration;
import com.inkglyph.server.config.RecognizerSettings;
import com.inkglyph.server.ink.Point;
import com.inkglyph.server.ink.SessionSnapshot;
import com.inkglyph.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline tool: renders a recorded strokes file the way the server does and
 * writes the raster next to it, then prints the top guesses if the model and
 * labels can be loaded.
 * Usage: StrokeFileRecognizer <strokes.json>
 *
 * The file holds {"strokes": [[{"x": 10, "y": 12}, ...], ...]}.
 */
public class StrokeFileRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(StrokeFileRecognizer.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: StrokeFileRecognizer <strokes.json>");
            System.exit(1);
        }
        System.setProperty("java.awt.headless", "true");

        File input = new File(args[0]);
        if (!input.isFile()) {
            System.err.println("Invalid strokes file: " + args[0]);
            System.exit(1);
        }

        RecognizerConfig.ConfigRoot config = RecognizerConfig.load();
        RecognizerSettings settings = RecognizerSettings.from(config);

        try {
            SessionSnapshot snapshot = readStrokes(input);
            logger.info("Read {} strokes ({} points) from {}", snapshot.getStrokes().size(), snapshot.pointCount(),
                    input);

            InkCapture capture = RecognizerConfiguration.buildCapture(settings);
            CaptureResult captured = capture.capture(snapshot);
            if (captured.isEmpty()) {
                logger.warn("Nothing to recognize in {}", input);
                return;
            }

            File png = new File(input.getParentFile(), stripExtension(input.getName()) + "_raster.png");
            ImageIO.write(captured.getRaster().toImage(), "png", png);
            logger.info("Wrote raster {} (bounds {}, scale {})", png.getAbsolutePath(), captured.getBounds(),
                    String.format("%.4f", captured.getScale()));

            try (GlyphRecognizer recognizer = RecognizerConfiguration.buildRecognizer(settings)) {
                recognizer.initialize(
                        LabelFileReader.read(Path.of(DataPathResolver.resolve(config, settings.labelsFile))),
                        InferenceEngineFactory.create(settings, config));
                List<RecognitionResult> results = recognizer.recognize(captured.getRaster());
                for (int i = 0; i < results.size(); i++) {
                    RecognitionResult r = results.get(i);
                    logger.info("#{} {} {}", i + 1, r.getGlyph(), String.format("%.1f%%", r.getConfidence() * 100));
                }
            } catch (RecognitionException e) {
                logger.warn("Skipping recognition: {}", e.getMessage());
            }
        } catch (IOException e) {
            logger.error("Failed to process {}", input, e);
            System.exit(2);
        }
    }

    static SessionSnapshot readStrokes(File file) throws IOException {
        JsonNode root = new ObjectMapper().readTree(file);
        JsonNode strokesNode = root.path("strokes");
        if (!strokesNode.isArray()) {
            throw new IOException("Missing 'strokes' array in " + file);
        }
        List<List<Point>> strokes = new ArrayList<>();
        for (JsonNode strokeNode : strokesNode) {
            List<Point> points = new ArrayList<>();
            for (JsonNode p : strokeNode) {
                points.add(new Point(p.path("x").asDouble(), p.path("y").asDouble()));
            }
            strokes.add(points);
        }
        return SessionSnapshot.of(strokes);
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
