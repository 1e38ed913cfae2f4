package com.dcruver.docvalidator;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.CorpusValidator;
import com.dcruver.docvalidator.domain.MetadataValidator;
import com.dcruver.docvalidator.domain.SeverityPolicy;
import com.dcruver.docvalidator.io.CorpusDiscovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * On-disk corpora and a fully wired pipeline for end-to-end tests.
 */
public final class TestCorpus {

    private TestCorpus() {
    }

    public static CorpusValidator validator(ValidatorProperties properties, Executor executor) {
        return new CorpusValidator(
            new CorpusDiscovery(properties),
            TestDocuments.loader(),
            new MetadataValidator(properties),
            TestDocuments.documentRules(properties),
            TestDocuments.corpusRules(properties),
            new SeverityPolicy(properties),
            executor);
    }

    public static CorpusValidator validator() {
        return validator(new ValidatorProperties(), Runnable::run);
    }

    public static Path write(Path root, String relativePath, String text) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, text);
    }

    /**
     * Clean document: valid metadata and a well-formed section, only a stub warning
     */
    public static Path writeClean(Path root, String relativePath) throws IOException {
        return write(root, relativePath, TestDocuments.VALID_METADATA
            + "## Overview\n\nNext.js reloads changed modules without a full refresh.\n");
    }

    /**
     * Mixed corpus: a clean file, a duplicate basename pair, a missing metadata block and a long section
     */
    public static void writeMixed(Path root) throws IOException {
        writeClean(root, "nextjs/hot-reload.md");
        writeClean(root, "nextjs/setup.md");
        writeClean(root, "sanity/setup.md");
        write(root, "php-wp/no-metadata.md", "# Hooks\n\n## Actions\nActions run at fixed points.\n");
        write(root, "php-wp/long-section.md", TestDocuments.VALID_METADATA
            + "## Query Loop\nThe loop renders posts.\n" + "w".repeat(1600) + "\n## Short\nIt is short.\n");
    }
}
