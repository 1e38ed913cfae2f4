package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.Section;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags sections whose effective length exceeds the chunk budget.
 * Level 2 is the primary chunk boundary; levels 3 to max-checked-level are measured separately
 * because the splitter falls back to them.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class SectionLengthRule implements DocumentRule {

    private final ValidatorProperties properties;

    @Override
    public String getName() {
        return "SectionLength";
    }

    @Override
    public String getDescription() {
        return "Sections must stay within " + properties.getMaxSectionLength() + " characters";
    }

    @Override
    public List<Finding> check(Document document) {
        int limit = properties.getMaxSectionLength();

        return document.getSections().getSections().stream()
            .filter(this::isChecked)
            .filter(section -> section.getEffectiveLength() > limit)
            .map(section -> Finding.of(RuleId.SECTION_LENGTH, document.getRelativePath())
                .location(section.getDisplayHeading())
                .line(section.getLine())
                .message(String.format("Section \"%s\" is %d characters (limit %d, %d over)",
                    section.getDisplayHeading(), section.getEffectiveLength(), limit,
                    section.getEffectiveLength() - limit))
                .build())
            .toList();
    }

    /**
     * Whether a section's level is covered by the length check
     */
    public boolean isChecked(Section section) {
        return section.getLevel() >= 2 && section.getLevel() <= properties.getMaxCheckedLevel();
    }
}
