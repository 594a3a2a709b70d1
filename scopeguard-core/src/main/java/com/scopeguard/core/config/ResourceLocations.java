package com.scopeguard.core.config;

import com.scopeguard.core.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 解析 "classpath:xxx" 或文件路径形式的资源位置
 */
final class ResourceLocations {

    static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceLocations() {
    }

    static InputStream open(String location) {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String name = location.substring(CLASSPATH_PREFIX.length());
            if (name.startsWith("/")) {
                name = name.substring(1);
            }
            InputStream is = classLoader().getResourceAsStream(name);
            if (is == null) {
                throw new ConfigurationException(location, "Classpath resource not found: " + name);
            }
            return is;
        }
        Path path = Paths.get(location);
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException(location, "File not found: " + path.toAbsolutePath());
        }
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new ConfigurationException(location, "Failed to open " + location, e);
        }
    }

    static ClassLoader classLoader() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return cl != null ? cl : ResourceLocations.class.getClassLoader();
    }
}
