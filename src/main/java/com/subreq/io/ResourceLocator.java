package com.subreq.io;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * Resolves configuration and input paths.
 * Supports classpath: prefix for classpath resources.
 */
public final class ResourceLocator {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceLocator() {
    }

    public static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }
}
