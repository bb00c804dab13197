package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.exception.SourceReadException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads source text as UTF-8, retrying once as ISO-8859-1 when the bytes are not valid UTF-8.
 */
@Slf4j
public final class SourceFileReader {

    private SourceFileReader() {
    }

    public static SourceFile read(Path file) throws SourceReadException {
        return read(file, file.toString());
    }

    public static SourceFile read(Path file, String attributedPath) throws SourceReadException {
        return SourceFile.of(attributedPath, readText(file));
    }

    public static String readText(Path file) throws SourceReadException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("File {} is not valid UTF-8, retrying as ISO-8859-1", file);
            try {
                return Files.readString(file, StandardCharsets.ISO_8859_1);
            } catch (IOException fallbackFailure) {
                throw new SourceReadException(file.toString(), fallbackFailure);
            }
        } catch (IOException e) {
            throw new SourceReadException(file.toString(), e);
        }
    }

    /**
     * Companion files (templates, code-behind) are optional: a missing or unreadable one is not an error.
     */
    public static Optional<SourceFile> readCompanion(Path file, String attributedPath) {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(file, attributedPath));
        } catch (SourceReadException e) {
            log.debug("Skipping unreadable companion file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
