package com.dcruver.docvalidator.domain;

import com.dcruver.docvalidator.domain.corpus.CorpusRule;
import com.dcruver.docvalidator.domain.rules.DocumentRule;
import com.dcruver.docvalidator.io.CorpusDiscovery;
import com.dcruver.docvalidator.io.CorpusListing;
import com.dcruver.docvalidator.io.DocumentLoader;
import com.dcruver.docvalidator.io.LoadedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the validation pipeline over a corpus in two phases.
 *
 * Phase 1 loads and checks every document independently and may fan out across the worker pool.
 * Phase 2 starts only after every document is loaded and runs the corpus-level rules over the full list.
 * Results are collected in discovery order, so parallel and sequential runs report identically.
 */
@Component
@Slf4j
public class CorpusValidator {

    private final CorpusDiscovery discovery;
    private final DocumentLoader loader;
    private final MetadataValidator metadataValidator;
    private final List<DocumentRule> documentRules;
    private final List<CorpusRule> corpusRules;
    private final SeverityPolicy severityPolicy;
    private final Executor executor;

    public CorpusValidator(
            CorpusDiscovery discovery,
            DocumentLoader loader,
            MetadataValidator metadataValidator,
            List<DocumentRule> documentRules,
            List<CorpusRule> corpusRules,
            SeverityPolicy severityPolicy,
            @Qualifier("documentValidationExecutor") Executor executor) {
        this.discovery = discovery;
        this.loader = loader;
        this.metadataValidator = metadataValidator;
        this.documentRules = List.copyOf(documentRules);
        this.corpusRules = List.copyOf(corpusRules);
        this.severityPolicy = severityPolicy;
        this.executor = executor;
    }

    public List<DocumentRule> getDocumentRules() {
        return documentRules;
    }

    public List<CorpusRule> getCorpusRules() {
        return corpusRules;
    }

    /**
     * Validate every eligible document under the root.
     *
     * @throws com.dcruver.docvalidator.io.InvalidInvocationException if the root is unusable
     */
    public ValidationRun validate(Path root) {
        long start = System.currentTimeMillis();
        CorpusListing listing = discovery.discover(root);
        List<Path> files = listing.getFiles();

        log.info("Phase 1: validating {} documents with {} rules", files.size(), documentRules.size());
        List<DocumentResult> results = validateDocuments(root, files);

        List<Document> documents = results.stream()
            .map(DocumentResult::getDocument)
            .toList();

        List<Finding> findings = new ArrayList<>();
        results.forEach(result -> findings.addAll(result.getFindings()));
        listing.getFailures().forEach((path, error) -> findings.addAll(unreadableEntry(root, path, error)));

        log.info("Phase 2: running {} corpus rules", corpusRules.size());
        findings.addAll(checkCorpus(documents));

        List<Finding> reported = severityPolicy.apply(findings).stream()
            .sorted(Finding.REPORT_ORDER)
            .toList();

        log.info("Validated {} documents in {} ms: {} findings",
            documents.size(), System.currentTimeMillis() - start, reported.size());

        return ValidationRun.builder()
            .root(root.toAbsolutePath().normalize())
            .documents(documents)
            .findings(reported)
            .build();
    }

    /**
     * Phase 1 over an explicit file list, results in input order
     */
    public List<DocumentResult> validateDocuments(Path root, List<Path> files) {
        List<CompletableFuture<DocumentResult>> futures = files.stream()
            .map(file -> CompletableFuture.supplyAsync(() -> validateDocument(root, file), executor))
            .toList();

        List<DocumentResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), root, files.get(i)));
        }
        return results;
    }

    /**
     * Load one file, then run the metadata validator and every document rule on it
     */
    public DocumentResult validateDocument(Path root, Path file) {
        String relativePath = CorpusDiscovery.relativePath(root, file);
        LoadedDocument loaded = loader.load(file, relativePath);
        return check(loaded);
    }

    /**
     * Per-document checks over an already loaded document
     */
    public DocumentResult check(LoadedDocument loaded) {
        Document document = loaded.getDocument();
        List<Finding> findings = new ArrayList<>(loaded.getFindings());

        if (document.isReadable()) {
            findings.addAll(metadataValidator.validate(document.getMetadata(), document.getRelativePath()));
            for (DocumentRule rule : documentRules) {
                findings.addAll(rule.check(document));
            }
        }

        log.debug("{}: {} findings", document.getRelativePath(), findings.size());
        return DocumentResult.builder()
            .document(document)
            .findings(findings)
            .build();
    }

    /**
     * Phase 2: corpus-level rules over every loaded document
     */
    public List<Finding> checkCorpus(List<Document> documents) {
        List<Finding> findings = new ArrayList<>();
        for (CorpusRule rule : corpusRules) {
            findings.addAll(rule.check(documents));
        }
        return findings;
    }

    /**
     * A directory or file the walk could not read; reported without taking part in the corpus rules
     */
    private List<Finding> unreadableEntry(Path root, Path path, IOException error) {
        String relativePath = CorpusDiscovery.relativePath(root, path);
        return loader.unreadable(path, relativePath, error).getFindings();
    }

    /**
     * Wait for one document; an unexpected worker failure becomes a read-error finding for that file only
     */
    private DocumentResult await(CompletableFuture<DocumentResult> future, Path root, Path file) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String relativePath = CorpusDiscovery.relativePath(root, file);
            log.error("Validation of {} failed unexpectedly", relativePath, cause);

            Exception failure = cause instanceof Exception ex ? ex : new RuntimeException(cause);
            LoadedDocument unreadable = loader.unreadable(file, relativePath, failure);
            return DocumentResult.builder()
                .document(unreadable.getDocument())
                .findings(unreadable.getFindings())
                .build();
        }
    }
}
