package com.inkglyph.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * JSON shape of recognizer_config.json. Every field is optional; unset values
 * resolve to the defaults in {@link RecognizerSettings}.
 */
public class RecognizerConfig {

    private static final Logger logger = LoggerFactory.getLogger(RecognizerConfig.class);

    public static final String CONFIG_PROPERTY = "inkglyph.config";
    public static final String DEFAULT_RESOURCE = "/recognizer_config.json";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfigRoot {
        public String dataDirectory;
        public CanvasConfig canvas;
        public ModelConfig model;
        public AlphabetConfig alphabet;
        public RankingConfig ranking;
        public CacheConfig cache;
        public WorkerConfig workers;
        public SessionConfig sessions;
    }

    public static class CanvasConfig {
        public Integer size;
        public Double strokeWidth;
        // Defaults to strokeWidth / 2
        public Double padding;
        public Double minSize;
        public Double maxSize;
    }

    public static class ModelConfig {
        public String engine;
        public String modelFile;
        public String labelsFile;
        public Integer inputSize;
        public String executionProvider;
        public String version;
    }

    public static class AlphabetConfig {
        // Hex ("0x3040") or decimal
        public String rangeStart;
        public String rangeEnd;
    }

    public static class RankingConfig {
        public Integer topK;
    }

    public static class CacheConfig {
        public Boolean enabled;
        public String dbFile;
    }

    public static class WorkerConfig {
        public Integer threads;
    }

    public static class SessionConfig {
        // Sessions untouched for this long are dropped
        public Long idleTimeoutSeconds;
        public Integer maxSessions;
    }

    /**
     * Reads the file named by the {@value #CONFIG_PROPERTY} system property, or
     * the bundled {@value #DEFAULT_RESOURCE}. Returns an empty root when neither
     * can be read.
     */
    public static ConfigRoot load() {
        ObjectMapper mapper = new ObjectMapper();

        String external = System.getProperty(CONFIG_PROPERTY);
        if (external != null && !external.isEmpty()) {
            File file = new File(external);
            try {
                ConfigRoot root = mapper.readValue(file, ConfigRoot.class);
                logger.info("Loaded recognizer config from {}", file.getAbsolutePath());
                return root;
            } catch (IOException e) {
                logger.warn("Failed to read recognizer config {}, falling back to bundled defaults", external, e);
            }
        }

        try (InputStream is = RecognizerConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is != null) {
                return mapper.readValue(is, ConfigRoot.class);
            }
            logger.warn("{} not found on classpath, using built-in defaults", DEFAULT_RESOURCE);
        } catch (IOException e) {
            logger.warn("Failed to parse {}, using built-in defaults", DEFAULT_RESOURCE, e);
        }
        return new ConfigRoot();
    }
}
