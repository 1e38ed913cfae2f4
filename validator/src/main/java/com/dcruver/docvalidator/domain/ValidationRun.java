package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a validation run produced, before aggregation into a report.
 */
@Data
@Builder
public class ValidationRun {
    private final Path root;
    private final List<Document> documents;

    // Per-document and corpus-level findings after severity policy, in report order
    private final List<Finding> findings;
}
