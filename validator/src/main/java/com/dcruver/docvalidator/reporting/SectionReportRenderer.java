package com.dcruver.docvalidator.reporting;

import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.SectionAnalysis;
import com.dcruver.docvalidator.domain.SectionMeasurement;
import org.springframework.stereotype.Component;

/**
 * Text output of the single-document drill-down.
 */
@Component
public class SectionReportRenderer {

    public String render(SectionAnalysis analysis) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Section analysis: %s (limit %d characters)\n\n",
            analysis.getPath(), analysis.getLimit()));

        for (Finding finding : analysis.getLoadFindings()) {
            sb.append(String.format("  note: %s\n", finding.getMessage()));
        }
        if (!analysis.getLoadFindings().isEmpty()) {
            sb.append("\n");
        }

        for (SectionMeasurement section : analysis.getSections()) {
            String indent = "  ".repeat(Math.max(0, section.getLevel() - 2));
            if (section.isOverLimit()) {
                sb.append(String.format("%s%s: %d chars FAIL (%d over, %d subsections, %d code blocks)\n",
                    indent, section.getHeading(), section.getLength(), section.getExcess(),
                    section.getSubsections(), section.getCodeBlocks()));
            } else {
                sb.append(String.format("%s%s: %d chars ok\n", indent, section.getHeading(), section.getLength()));
            }
        }

        sb.append(String.format("\n%d/%d sections exceed the limit\n",
            analysis.getFailingCount(), analysis.getSections().size()));
        return sb.toString();
    }
}
