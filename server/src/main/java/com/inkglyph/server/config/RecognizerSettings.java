package com.inkglyph.server.config;

/**
 * Resolved recognizer constants. Built once from a
 * {@link RecognizerConfig.ConfigRoot}; anything the JSON leaves out takes the
 * default below.
 */
public class RecognizerSettings {

    public static final int DEFAULT_CANVAS_SIZE = 300;
    public static final double DEFAULT_STROKE_WIDTH = 12.0;
    public static final double DEFAULT_MIN_SIZE = 80.0;
    public static final double DEFAULT_MAX_SIZE = 220.0;
    public static final int DEFAULT_MODEL_INPUT_SIZE = 64;
    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_RANGE_START = 0x3040;
    public static final int DEFAULT_RANGE_END = 0x309F;
    public static final long DEFAULT_SESSION_IDLE_TIMEOUT_SECONDS = 1800;
    public static final int DEFAULT_MAX_SESSIONS = 1000;

    public final int canvasSize;
    public final double strokeWidth;
    public final double padding;
    public final double minSize;
    public final double maxSize;

    public final String engine;
    public final String modelFile;
    public final String labelsFile;
    public final int modelInputSize;
    public final String executionProvider;
    public final String modelVersion;

    public final int rangeStart;
    public final int rangeEnd;
    public final int topK;

    public final boolean cacheEnabled;
    public final String cacheDbFile;
    public final int workerThreads;

    public final long sessionIdleTimeoutSeconds;
    public final int maxSessions;

    private RecognizerSettings(RecognizerConfig.ConfigRoot root) {
        RecognizerConfig.CanvasConfig canvas = root.canvas != null ? root.canvas : new RecognizerConfig.CanvasConfig();
        RecognizerConfig.ModelConfig model = root.model != null ? root.model : new RecognizerConfig.ModelConfig();
        RecognizerConfig.AlphabetConfig alphabet = root.alphabet != null ? root.alphabet
                : new RecognizerConfig.AlphabetConfig();
        RecognizerConfig.RankingConfig ranking = root.ranking != null ? root.ranking
                : new RecognizerConfig.RankingConfig();
        RecognizerConfig.CacheConfig cache = root.cache != null ? root.cache : new RecognizerConfig.CacheConfig();
        RecognizerConfig.WorkerConfig workers = root.workers != null ? root.workers
                : new RecognizerConfig.WorkerConfig();
        RecognizerConfig.SessionConfig sessions = root.sessions != null ? root.sessions
                : new RecognizerConfig.SessionConfig();

        this.canvasSize = canvas.size != null ? canvas.size : DEFAULT_CANVAS_SIZE;
        this.strokeWidth = canvas.strokeWidth != null ? canvas.strokeWidth : DEFAULT_STROKE_WIDTH;
        this.padding = canvas.padding != null ? canvas.padding : strokeWidth / 2.0;
        this.minSize = canvas.minSize != null ? canvas.minSize : DEFAULT_MIN_SIZE;
        this.maxSize = canvas.maxSize != null ? canvas.maxSize : DEFAULT_MAX_SIZE;

        this.engine = model.engine != null ? model.engine : "onnx";
        this.modelFile = model.modelFile != null ? model.modelFile : "hiragana_model.onnx";
        this.labelsFile = model.labelsFile != null ? model.labelsFile : "hiragana_labels.txt";
        this.modelInputSize = model.inputSize != null ? model.inputSize : DEFAULT_MODEL_INPUT_SIZE;
        this.executionProvider = model.executionProvider != null ? model.executionProvider : "cpu";
        this.modelVersion = model.version;

        this.rangeStart = parseCodePoint(alphabet.rangeStart, DEFAULT_RANGE_START);
        this.rangeEnd = parseCodePoint(alphabet.rangeEnd, DEFAULT_RANGE_END);
        this.topK = ranking.topK != null ? ranking.topK : DEFAULT_TOP_K;

        this.cacheEnabled = cache.enabled != null && cache.enabled;
        this.cacheDbFile = cache.dbFile != null ? cache.dbFile : "inkglyph_cache.db";
        this.workerThreads = workers.threads != null && workers.threads > 0 ? workers.threads : 2;

        this.sessionIdleTimeoutSeconds = sessions.idleTimeoutSeconds != null && sessions.idleTimeoutSeconds > 0
                ? sessions.idleTimeoutSeconds
                : DEFAULT_SESSION_IDLE_TIMEOUT_SECONDS;
        this.maxSessions = sessions.maxSessions != null && sessions.maxSessions > 0 ? sessions.maxSessions
                : DEFAULT_MAX_SESSIONS;
    }

    public static RecognizerSettings from(RecognizerConfig.ConfigRoot root) {
        return new RecognizerSettings(root != null ? root : new RecognizerConfig.ConfigRoot());
    }

    public static RecognizerSettings defaults() {
        return from(new RecognizerConfig.ConfigRoot());
    }

    static int parseCodePoint(String value, int fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        String v = value.trim();
        if (v.startsWith("U+") || v.startsWith("u+")) {
            return Integer.parseInt(v.substring(2), 16);
        }
        return Integer.decode(v);
    }
}
