package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Phase 1 output for one file: the loaded document and its per-document findings.
 */
@Data
@Builder
public class DocumentResult {
    private final Document document;
    private final List<Finding> findings;
}
