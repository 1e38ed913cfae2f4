package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;

import java.util.List;

/**
 * An independent structural check over one document's section model.
 * Implementations are pure: no shared state and no ordering dependency on other rules.
 * Only called for readable documents.
 */
public interface DocumentRule {
    String getName();
    String getDescription();
    List<Finding> check(Document document);
}
