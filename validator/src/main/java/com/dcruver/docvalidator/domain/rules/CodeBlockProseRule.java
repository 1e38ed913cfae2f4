package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Every code block needs at least one line of prose between its heading and the fence.
 */
@Component
@Order(70)
public class CodeBlockProseRule implements DocumentRule {

    @Override
    public String getName() {
        return "CodeBlockProse";
    }

    @Override
    public String getDescription() {
        return "Code blocks must be introduced by prose";
    }

    @Override
    public List<Finding> check(Document document) {
        return document.getSections().getAllSections().stream()
            .flatMap(section -> section.getCodeBlocks().stream()
                .filter(block -> !block.isProseBefore())
                .map(block -> Finding.of(RuleId.CODE_BLOCK_NEEDS_PROSE, document.getRelativePath())
                    .location(section.isRoot() ? "line " + block.getLine() : section.getDisplayHeading())
                    .line(block.getLine())
                    .message(section.isRoot()
                        ? "Code block at the start of the document has no introducing prose"
                        : String.format("Code block follows \"%s\" without introducing prose (%d lines below the heading)",
                            section.getDisplayHeading(), block.getLinesFromHeading()))
                    .build()))
            .toList();
    }
}
