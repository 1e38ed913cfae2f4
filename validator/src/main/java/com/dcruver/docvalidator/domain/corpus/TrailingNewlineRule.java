package com.dcruver.docvalidator.domain.corpus;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(40)
public class TrailingNewlineRule implements CorpusRule {

    @Override
    public String getName() {
        return "TrailingNewline";
    }

    @Override
    public String getDescription() {
        return "Files must end with a newline";
    }

    @Override
    public List<Finding> check(List<Document> corpus) {
        return corpus.stream()
            .filter(Document::isReadable)
            .filter(document -> !document.getRawText().isEmpty() && !document.getRawText().endsWith("\n"))
            .map(document -> Finding.of(RuleId.MISSING_TRAILING_NEWLINE, document.getRelativePath())
                .location("line " + document.getLineCount())
                .line(document.getLineCount())
                .message("File does not end with a newline")
                .build())
            .toList();
    }
}
