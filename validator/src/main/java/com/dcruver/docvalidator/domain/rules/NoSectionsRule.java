package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(10)
@RequiredArgsConstructor
public class NoSectionsRule implements DocumentRule {

    private final ValidatorProperties properties;

    @Override
    public String getName() {
        return "NoSections";
    }

    @Override
    public String getDescription() {
        return "Document must contain at least one ## section";
    }

    @Override
    public List<Finding> check(Document document) {
        if (!properties.isRequireSections() || document.getSections().hasSectionAtLevel(2)) {
            return List.of();
        }
        return List.of(Finding.of(RuleId.NO_SECTIONS, document.getRelativePath())
            .message("No ## sections found in document; the whole body becomes one chunk")
            .build());
    }
}
