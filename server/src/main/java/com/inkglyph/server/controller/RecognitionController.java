package com.inkglyph.server.controller;

import com.inkglyph.server.ai.CaptureResult;
import com.inkglyph.server.ai.InvalidInputException;
import com.inkglyph.server.ai.NotInitializedException;
import com.inkglyph.server.ai.RecognitionException;
import com.inkglyph.server.ai.inference.InferenceException;
import com.inkglyph.server.ink.Point;
import com.inkglyph.server.ink.SessionSnapshot;
import com.inkglyph.server.service.RecognitionOutcome;
import com.inkglyph.server.service.RecognitionService;
import com.inkglyph.server.service.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RestController
public class RecognitionController {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionController.class);

    private final RecognitionService recognitionService;
    private final SessionRegistry sessions;

    public RecognitionController(RecognitionService recognitionService, SessionRegistry sessions) {
        this.recognitionService = recognitionService;
        this.sessions = sessions;
    }

    public static class PointRequest {
        public Double x;
        public Double y;
    }

    public static class StrokesRequest {
        // strokes[i] is one pen-down to pen-up sequence
        public List<List<PointRequest>> strokes;
    }

    @PostMapping("/ink/sessions")
    public ResponseEntity<?> createSession() {
        SessionRegistry.SessionEntry entry = sessions.create();
        return ResponseEntity.ok(Map.of("sessionId", entry.getId()));
    }

    @DeleteMapping("/ink/sessions/{id}")
    public ResponseEntity<?> deleteSession(@PathVariable("id") String id) {
        return sessions.remove(id) ? ResponseEntity.noContent().build() : unknownSession(id);
    }

    @PostMapping("/ink/sessions/{id}/strokes/begin")
    public ResponseEntity<?> beginStroke(@PathVariable("id") String id, @RequestBody PointRequest point) {
        Optional<SessionRegistry.SessionEntry> entry = sessions.find(id);
        if (entry.isEmpty()) {
            return unknownSession(id);
        }
        if (!isValid(point)) {
            return ResponseEntity.badRequest().body("Point must carry finite x and y.");
        }
        entry.get().getSession().beginStroke(new Point(point.x, point.y));
        return revision(entry.get());
    }

    @PostMapping("/ink/sessions/{id}/strokes/extend")
    public ResponseEntity<?> extendStroke(@PathVariable("id") String id, @RequestBody PointRequest point) {
        Optional<SessionRegistry.SessionEntry> entry = sessions.find(id);
        if (entry.isEmpty()) {
            return unknownSession(id);
        }
        if (!isValid(point)) {
            return ResponseEntity.badRequest().body("Point must carry finite x and y.");
        }
        entry.get().getSession().extendStroke(new Point(point.x, point.y));
        return revision(entry.get());
    }

    @PostMapping("/ink/sessions/{id}/strokes/end")
    public ResponseEntity<?> endStroke(@PathVariable("id") String id) {
        Optional<SessionRegistry.SessionEntry> entry = sessions.find(id);
        if (entry.isEmpty()) {
            return unknownSession(id);
        }
        entry.get().getSession().endStroke();
        return revision(entry.get());
    }

    @DeleteMapping("/ink/sessions/{id}/strokes")
    public ResponseEntity<?> clearStrokes(@PathVariable("id") String id) {
        Optional<SessionRegistry.SessionEntry> entry = sessions.find(id);
        if (entry.isEmpty()) {
            return unknownSession(id);
        }
        entry.get().getSession().clear();
        return revision(entry.get());
    }

    @PostMapping("/ink/sessions/{id}/recognize")
    public CompletableFuture<ResponseEntity<?>> recognizeSession(@PathVariable("id") String id) {
        Optional<SessionRegistry.SessionEntry> found = sessions.find(id);
        if (found.isEmpty()) {
            return CompletableFuture.completedFuture(unknownSession(id));
        }
        SessionRegistry.SessionEntry entry = found.get();
        SessionSnapshot snapshot = entry.getSession().snapshot();

        CompletableFuture<RecognitionOutcome> pending;
        try {
            pending = recognitionService.submit(snapshot);
        } catch (RecognitionException e) {
            return CompletableFuture.completedFuture(errorResponse(e));
        }

        return pending.<ResponseEntity<?>>thenApply(outcome -> {
            boolean accepted = entry.getLatest().offer(outcome);
            if (!accepted) {
                logger.debug("Session {}: outcome #{} superseded", id, outcome.getSequence());
            }
            return ResponseEntity.ok(outcome);
        }).exceptionally(t -> errorResponse(unwrap(t)));
    }

    @GetMapping("/ink/sessions/{id}/result")
    public ResponseEntity<?> latestResult(@PathVariable("id") String id) {
        Optional<SessionRegistry.SessionEntry> entry = sessions.find(id);
        if (entry.isEmpty()) {
            return unknownSession(id);
        }
        RecognitionOutcome outcome = entry.get().getLatest().get();
        if (outcome == null) {
            return ResponseEntity.noContent().build();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("outcome", outcome);
        body.put("current", entry.get().isLatestCurrent());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/ink/sessions/{id}/raster.png")
    public ResponseEntity<?> raster(@PathVariable("id") String id) {
        Optional<SessionRegistry.SessionEntry> entry = sessions.find(id);
        if (entry.isEmpty()) {
            return unknownSession(id);
        }
        RecognitionOutcome outcome = entry.get().getLatest().get();
        CaptureResult captured = null;
        if (outcome == null || outcome.getRaster() == null || !entry.get().isLatestCurrent()) {
            captured = recognitionService.capture(entry.get().getSession().snapshot());
            if (captured.isEmpty()) {
                return ResponseEntity.noContent().build();
            }
        }
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write((captured != null ? captured.getRaster() : outcome.getRaster()).toImage(), "png", out);
            return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(out.toByteArray());
        } catch (IOException e) {
            logger.error("Failed to encode raster preview for session {}", id, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/recognize-strokes")
    public ResponseEntity<?> recognizeStrokes(@RequestBody StrokesRequest request) {
        if (!recognitionService.isReady()) {
            return ResponseEntity.status(503).body(notReadyMessage());
        }
        if (request == null || request.strokes == null) {
            return ResponseEntity.badRequest().body("Request must contain a 'strokes' array.");
        }

        List<List<Point>> strokes = new ArrayList<>();
        for (List<PointRequest> stroke : request.strokes) {
            List<Point> points = new ArrayList<>();
            if (stroke != null) {
                for (PointRequest p : stroke) {
                    if (!isValid(p)) {
                        return ResponseEntity.badRequest().body("Point must carry finite x and y.");
                    }
                    points.add(new Point(p.x, p.y));
                }
            }
            strokes.add(points);
        }

        logger.info("Received stateless recognition request with {} strokes.", strokes.size());
        try {
            return ResponseEntity.ok(recognitionService.recognize(SessionSnapshot.of(strokes)));
        } catch (RecognitionException e) {
            return errorResponse(e);
        }
    }

    private ResponseEntity<?> revision(SessionRegistry.SessionEntry entry) {
        return ResponseEntity.ok(Map.of("revision", entry.getCurrentRevision()));
    }

    private ResponseEntity<?> unknownSession(String id) {
        return ResponseEntity.status(404).body("Unknown session " + id);
    }

    private String notReadyMessage() {
        String error = recognitionService.getInitError();
        return error != null ? "Recognizer failed to initialize: " + error
                : "Recognizer is still initializing, please try again later.";
    }

    private ResponseEntity<?> errorResponse(Throwable t) {
        if (t instanceof NotInitializedException) {
            return ResponseEntity.status(503).body(notReadyMessage());
        }
        if (t instanceof InvalidInputException) {
            return ResponseEntity.badRequest().body(t.getMessage());
        }
        if (t instanceof InferenceException) {
            logger.error("Inference failed", t);
            return ResponseEntity.status(502).body(t.getMessage());
        }
        logger.error("Recognition failed", t);
        return ResponseEntity.internalServerError().body(t.getMessage());
    }

    private static Throwable unwrap(Throwable t) {
        return (t instanceof CompletionException && t.getCause() != null) ? t.getCause() : t;
    }

    private static boolean isValid(PointRequest p) {
        return p != null && p.x != null && p.y != null && Double.isFinite(p.x) && Double.isFinite(p.y);
    }
}
