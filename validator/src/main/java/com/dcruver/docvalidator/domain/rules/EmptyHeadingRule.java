package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags headings with nothing beneath them before the next heading of the same or a shallower level.
 * Such headings produce empty chunks.
 */
@Component
@Order(40)
public class EmptyHeadingRule implements DocumentRule {

    @Override
    public String getName() {
        return "EmptyHeading";
    }

    @Override
    public String getDescription() {
        return "Headings must have content";
    }

    @Override
    public List<Finding> check(Document document) {
        return document.getSections().getSections().stream()
            .filter(section -> section.isContentBlank())
            .map(section -> Finding.of(RuleId.EMPTY_HEADING, document.getRelativePath())
                .location(section.getDisplayHeading())
                .line(section.getLine())
                .message(String.format("Heading \"%s\" has no content", section.getDisplayHeading()))
                .build())
            .toList();
    }
}
