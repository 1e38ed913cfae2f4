package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.CodeBlock;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.Section;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Long code blocks need their own ### (or deeper) heading so the splitter can isolate them.
 */
@Component
@Order(60)
@RequiredArgsConstructor
public class CodeBlockSubsectionRule implements DocumentRule {

    private static final int SUBSECTION_LEVEL = 3;

    private final ValidatorProperties properties;

    @Override
    public String getName() {
        return "CodeBlockSubsection";
    }

    @Override
    public String getDescription() {
        return "Code blocks over " + properties.getLongCodeBlockLines() + " lines need a ### subsection";
    }

    @Override
    public List<Finding> check(Document document) {
        int threshold = properties.getLongCodeBlockLines();

        return document.getSections().getAllSections().stream()
            .filter(section -> section.getLevel() < SUBSECTION_LEVEL)
            .flatMap(section -> section.getCodeBlocks().stream()
                .filter(block -> block.getLineCount() > threshold)
                .map(block -> toFinding(document, section, block)))
            .toList();
    }

    private Finding toFinding(Document document, Section section, CodeBlock block) {
        return Finding.of(RuleId.CODE_BLOCK_NEEDS_SUBSECTION, document.getRelativePath())
            .location(section.isRoot() ? "line " + block.getLine() : section.getDisplayHeading())
            .line(block.getLine())
            .message(String.format("Code block with %d lines (threshold %d) sits directly under %s; give it its own ### subsection",
                block.getLineCount(), properties.getLongCodeBlockLines(),
                section.isRoot() ? "the document body" : "\"" + section.getDisplayHeading() + "\""))
            .build();
    }
}
