package com.dcruver.docvalidator.io;

import lombok.Builder;
import lombok.Data;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Result of walking a corpus root.
 */
@Data
@Builder
public class CorpusListing {

    // Eligible documents, sorted
    private final List<Path> files;

    // Entries below the root that could not be read during the walk, sorted by path
    private final Map<Path, IOException> failures;
}
