package com.pdfextract.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads key=value pairs from a local ".env" file into System properties before Spring starts.
 *
 * Keys already defined as environment variables or system properties are left untouched, so
 * provider keys (GEMINI_API_KEY, OPENAI_API_KEY, ...) can live in .env during development only.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final List<Path> CANDIDATES = List.of(
            Path.of(".env"),
            Path.of("backend", ".env")
    );

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Path envPath = CANDIDATES.stream()
                .filter(p -> Files.isRegularFile(p))
                .findFirst()
                .orElse(null);
        if (envPath == null) {
            return;
        }

        try {
            int loaded = 0;
            for (String raw : Files.readAllLines(envPath, StandardCharsets.UTF_8)) {
                String line = raw == null ? "" : raw.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("export ")) {
                    line = line.substring("export ".length()).trim();
                }

                int idx = line.indexOf('=');
                if (idx <= 0) continue;

                String key = line.substring(0, idx).trim();
                String value = unquote(line.substring(idx + 1).trim());
                if (key.isEmpty() || value.isEmpty()) continue;

                if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) {
                    continue;
                }

                System.setProperty(key, value);
                loaded++;
            }

            if (loaded > 0) {
                log.info("[DotenvLoader] Loaded {} keys from {} (values hidden)", loaded, envPath.toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] Failed to read .env (ignored): {}", e.getMessage());
        }
    }

    static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
