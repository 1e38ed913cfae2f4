package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;

/**
 * One corpus file as loaded for a validation run.
 * Immutable; never written back.
 */
@Data
@Builder
public class Document {
    private final Path path;

    // Corpus-relative path with forward slashes
    private final String relativePath;

    @ToString.Exclude
    private final String rawText;  // null when the file could not be read

    private final Metadata metadata;

    @ToString.Exclude
    private final String body;
    private final int bodyStartLine;

    @ToString.Exclude
    private final SectionTree sections;  // null when the file could not be read

    private final LoadStatus status;
    private final int lineCount;

    public String getBasename() {
        return path.getFileName().toString();
    }

    /**
     * Whether text is available for structural checks
     */
    public boolean isReadable() {
        return status != LoadStatus.IO_ERROR && rawText != null;
    }
}
