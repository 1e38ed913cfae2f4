package com.dcruver.docvalidator.domain.corpus;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Classifies files by total line count: stubs below the low threshold, oversized above the high one.
 */
@Component
@Order(30)
@RequiredArgsConstructor
public class FileSizeRule implements CorpusRule {

    private final ValidatorProperties properties;

    @Override
    public String getName() {
        return "FileSize";
    }

    @Override
    public String getDescription() {
        return String.format("Files should have between %d and %d lines",
            properties.getStubLineCount(), properties.getOversizedLineCount());
    }

    @Override
    public List<Finding> check(List<Document> corpus) {
        return corpus.stream()
            .filter(Document::isReadable)
            .flatMap(document -> classify(document).stream())
            .toList();
    }

    private Optional<Finding> classify(Document document) {
        int lines = document.getLineCount();

        if (lines < properties.getStubLineCount()) {
            return Optional.of(Finding.of(RuleId.STUB_FILE, document.getRelativePath())
                .message(String.format("File is classified as stub (%d lines, threshold: %d)",
                    lines, properties.getStubLineCount()))
                .build());
        }
        if (lines > properties.getOversizedLineCount()) {
            return Optional.of(Finding.of(RuleId.OVERSIZED_FILE, document.getRelativePath())
                .message(String.format("File is classified as oversized (%d lines, threshold: %d)",
                    lines, properties.getOversizedLineCount()))
                .build());
        }
        return Optional.empty();
    }
}
