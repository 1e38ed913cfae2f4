package com.dcruver.docvalidator.io;

import com.dcruver.docvalidator.config.ValidatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds eligible documents under a corpus root.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CorpusDiscovery {

    private final ValidatorProperties properties;

    /**
     * Recursively list documents with a configured extension (case-insensitive), sorted by path.
     * Unreadable entries below the root are returned as failures rather than aborting the walk.
     *
     * @throws InvalidInvocationException if the root is missing, not a directory, or cannot be read
     */
    public CorpusListing discover(Path root) {
        Path docsDir = root.toAbsolutePath().normalize();

        if (!Files.exists(docsDir)) {
            throw new InvalidInvocationException(docsDir, "Docs directory not found: " + docsDir);
        }
        if (!Files.isDirectory(docsDir)) {
            throw new InvalidInvocationException(docsDir, "Docs path is not a directory: " + docsDir);
        }

        CorpusWalker walker = new CorpusWalker(docsDir, properties.getExtensions(), properties.getExcludedDirs());
        try {
            Files.walkFileTree(docsDir, walker);
        } catch (IOException e) {
            throw new InvalidInvocationException(docsDir, "Failed to read docs directory: " + e.getMessage(), e);
        }

        CorpusListing listing = walker.toListing();
        log.info("Found {} documents under {} ({} unreadable entries)",
            listing.getFiles().size(), docsDir, listing.getFailures().size());
        return listing;
    }

    /**
     * Path relative to the corpus root with forward slashes
     */
    public static String relativePath(Path root, Path file) {
        Path base = root.toAbsolutePath().normalize();
        return base.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
