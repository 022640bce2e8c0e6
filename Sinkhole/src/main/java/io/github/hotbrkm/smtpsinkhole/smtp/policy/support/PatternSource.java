package io.github.hotbrkm.smtpsinkhole.smtp.policy.support;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves match arguments into pattern lists for one connection.
 * <p>
 * An argument starting with {@code /}, {@code ./} or {@code file:} names a
 * pattern file: one pattern per line, blank lines and {@code #} comments
 * skipped. A missing or unreadable file yields an empty list. Files are read
 * at most once per instance, so a new instance is made for every connection.
 * </p>
 */
@Slf4j
public class PatternSource {

    private static final String FILE_PREFIX = "file:";

    private final Map<String, List<String>> files = new HashMap<>();

    /**
     * @param argument literal pattern or file reference
     * @return ordered patterns; a literal resolves to itself
     */
    public List<String> resolve(String argument) {
        if (!isFileReference(argument)) {
            return List.of(argument);
        }
        String path = argument.startsWith(FILE_PREFIX) ? argument.substring(FILE_PREFIX.length()) : argument;
        return files.computeIfAbsent(path, PatternSource::read);
    }

    public static boolean isFileReference(String argument) {
        return argument.startsWith("/") || argument.startsWith("./") || argument.startsWith(FILE_PREFIX);
    }

    private static List<String> read(String path) {
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            log.debug("Pattern file {} does not exist; treating it as empty", path);
            return List.of();
        }
        try {
            List<String> patterns = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                patterns.add(trimmed);
            }
            return List.copyOf(patterns);
        } catch (IOException e) {
            log.debug("Failed to read pattern file {}: {}", path, e.getMessage());
            return List.of();
        }
    }
}
