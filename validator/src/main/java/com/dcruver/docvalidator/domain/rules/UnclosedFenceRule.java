package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(80)
public class UnclosedFenceRule implements DocumentRule {

    @Override
    public String getName() {
        return "UnclosedFence";
    }

    @Override
    public String getDescription() {
        return "Code fences must be closed";
    }

    @Override
    public List<Finding> check(Document document) {
        return document.getSections().getAllSections().stream()
            .flatMap(section -> section.getCodeBlocks().stream())
            .filter(block -> !block.isClosed())
            .map(block -> Finding.of(RuleId.UNCLOSED_CODE_FENCE, document.getRelativePath())
                .location("line " + block.getLine())
                .line(block.getLine())
                .message("Code fence opened at line " + block.getLine()
                    + " is never closed; everything after it is treated as code")
                .build())
            .toList();
    }
}
