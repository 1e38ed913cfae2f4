package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.Section;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags headings that jump more than one level deeper than the heading before them.
 * The document title counts as level 1, so a body opening with ### is a skip.
 */
@Component
@Order(30)
public class HeadingSkipRule implements DocumentRule {

    private static final int TITLE_LEVEL = 1;

    @Override
    public String getName() {
        return "HeadingSkip";
    }

    @Override
    public String getDescription() {
        return "Heading levels must not be skipped";
    }

    @Override
    public List<Finding> check(Document document) {
        List<Finding> findings = new ArrayList<>();
        int previousLevel = TITLE_LEVEL;

        for (Section section : document.getSections().getSections()) {
            if (section.getLevel() > previousLevel + 1) {
                findings.add(Finding.of(RuleId.HEADING_SKIP, document.getRelativePath())
                    .location(section.getDisplayHeading())
                    .line(section.getLine())
                    .message(String.format("Heading hierarchy skip: went from %s to %s at \"%s\"",
                        "#".repeat(previousLevel), "#".repeat(section.getLevel()), section.getHeading()))
                    .build());
            }
            previousLevel = section.getLevel();
        }

        return findings;
    }
}
