package com.inkglyph.server.ai.labels;

import com.inkglyph.server.ai.InitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a label file from disk, falling back to the classpath.
 */
public class LabelFileReader {

    private static final Logger logger = LoggerFactory.getLogger(LabelFileReader.class);

    public static LabelTable read(Path path) {
        if (Files.isRegularFile(path)) {
            try {
                LabelTable table = LabelTable.parse(Files.readString(path, StandardCharsets.UTF_8));
                logger.info("Loaded {} labels from {}", table.size(), path.toAbsolutePath());
                return table;
            } catch (IOException e) {
                throw new InitializationException("Failed to read label file " + path, e);
            }
        }

        String resource = "/" + path.getFileName();
        try (InputStream is = LabelFileReader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new InitializationException("Label file not found: " + path + " (also tried classpath "
                        + resource + ")");
            }
            LabelTable table = LabelTable.parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
            logger.info("Loaded {} labels from classpath {}", table.size(), resource);
            return table;
        } catch (IOException e) {
            throw new InitializationException("Failed to read label resource " + resource, e);
        }
    }
}
