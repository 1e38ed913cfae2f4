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
import java.util.Optional;

/**
 * Flags sections whose first prose line starts with a pronoun.
 * A retrieved chunk is read without its predecessor, so "It" has nothing to refer to.
 */
@Component
@Order(50)
@RequiredArgsConstructor
public class PronounOpeningRule implements DocumentRule {

    private static final int EXCERPT_LENGTH = 80;

    private final ValidatorProperties properties;

    @Override
    public String getName() {
        return "PronounOpening";
    }

    @Override
    public String getDescription() {
        return "Sections must not open with " + String.join("/", properties.getDiscouragedOpeners());
    }

    @Override
    public List<Finding> check(Document document) {
        return document.getSections().getSections().stream()
            .flatMap(section -> matchOpener(section)
                .map(opener -> Finding.of(RuleId.PRONOUN_OPENING, document.getRelativePath())
                    .location(section.getDisplayHeading())
                    .line(section.getLine())
                    .message(String.format("Section \"%s\" opens with \"%s\": %s",
                        section.getDisplayHeading(), opener, excerpt(section.getOpeningLine())))
                    .build())
                .stream())
            .toList();
    }

    private Optional<String> matchOpener(Section section) {
        String opening = section.getOpeningLine();
        if (opening == null || opening.isBlank()) {
            return Optional.empty();
        }
        String firstToken = opening.split("\\s+", 2)[0];
        return properties.getDiscouragedOpeners().contains(firstToken)
            ? Optional.of(firstToken)
            : Optional.empty();
    }

    private String excerpt(String line) {
        return line.length() <= EXCERPT_LENGTH ? line : line.substring(0, EXCERPT_LENGTH) + "...";
    }
}
