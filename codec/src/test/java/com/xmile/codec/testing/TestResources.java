package com.xmile.codec.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    private static final Path CLASSPATH_CACHE_DIR = initClasspathCacheDir();

    /** Text of a classpath resource such as {@code models/teacup.xmile}. */
    public static String read(String resourceName) {
        try (InputStream in = open(resourceName)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + resourceName, ex);
        }
    }

    public static InputStream open(String resourceName) throws IOException {
        String normalized = normalize(resourceName);
        InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized);
        if (in == null) {
            throw new IOException("Missing classpath resource: " + normalized);
        }
        return in;
    }

    /** Copies a classpath resource to a temporary file so path-based APIs can read it. */
    public static Path extract(String resourceName) throws IOException {
        String normalized = normalize(resourceName);
        try (InputStream in = open(normalized)) {
            Path target = CLASSPATH_CACHE_DIR.resolve(normalized).normalize();
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            return target;
        }
    }

    private static String normalize(String resourceName) {
        return resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
    }

    private static Path initClasspathCacheDir() {
        try {
            Path dir = Files.createTempDirectory("xmile_test_resources");
            dir.toFile().deleteOnExit();
            return dir;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create classpath cache directory", ex);
        }
    }
}
