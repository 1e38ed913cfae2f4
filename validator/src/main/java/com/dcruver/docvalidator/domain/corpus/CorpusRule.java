package com.dcruver.docvalidator.domain.corpus;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;

import java.util.List;

/**
 * A check that runs after every document has been loaded.
 * Receives the whole corpus, including documents that failed to load.
 */
public interface CorpusRule {
    String getName();
    String getDescription();
    List<Finding> check(List<Document> corpus);
}
