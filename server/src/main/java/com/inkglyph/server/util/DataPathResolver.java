package com.inkglyph.server.util;

import com.inkglyph.server.config.RecognizerConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "inkglyph.data.dir";

    public static String resolveDataDirectory(RecognizerConfig.ConfigRoot config) {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        if (config != null && config.dataDirectory != null && !config.dataDirectory.isEmpty()) {
            return config.dataDirectory;
        }

        // 3. Default
        return ".";
    }

    public static String resolve(RecognizerConfig.ConfigRoot config, String fileName) {
        File f = new File(fileName);
        if (f.isAbsolute()) {
            return fileName;
        }
        return resolveDataDirectory(config) + File.separator + fileName;
    }
}
