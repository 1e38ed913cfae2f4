package com.dcruver.docvalidator.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects eligible documents during a tree walk.
 * A subtree or file that cannot be read is recorded and skipped; only a failure on the root itself aborts the walk.
 */
@Slf4j
class CorpusWalker extends SimpleFileVisitor<Path> {

    private final Path root;
    private final List<String> extensions;
    private final Collection<String> excludedDirs;
    private final List<Path> files = new ArrayList<>();
    private final Map<Path, IOException> failures = new TreeMap<>();

    CorpusWalker(Path root, List<String> extensions, Collection<String> excludedDirs) {
        this.root = root;
        this.extensions = extensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
        this.excludedDirs = excludedDirs;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (!dir.equals(root) && excludedDirs.contains(dir.getFileName().toString())) {
            log.debug("Skipping excluded directory {}", dir);
            return FileVisitResult.SKIP_SUBTREE;
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile() && isEligible(file)) {
            files.add(file);
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
        if (file.equals(root)) {
            throw exc;
        }
        if (Files.isRegularFile(file) && !isEligible(file)) {
            log.debug("Ignoring unreadable non-document {}", file);
            return FileVisitResult.CONTINUE;
        }
        log.warn("Cannot read {}: {}", file, exc.toString());
        failures.put(file, exc);
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
        if (exc != null) {
            if (dir.equals(root)) {
                throw exc;
            }
            log.warn("Directory listing of {} did not complete: {}", dir, exc.toString());
            failures.put(dir, exc);
        }
        return FileVisitResult.CONTINUE;
    }

    boolean isEligible(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    CorpusListing toListing() {
        return CorpusListing.builder()
            .files(files.stream().sorted().toList())
            .failures(new TreeMap<>(failures))
            .build();
    }
}
