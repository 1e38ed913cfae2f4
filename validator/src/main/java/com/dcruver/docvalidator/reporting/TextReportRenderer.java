package com.dcruver.docvalidator.reporting;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Finding;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-oriented form of the report for the terminal.
 * Totals come first, then worst offenders, so a reader can triage before the full listing.
 */
@Component
@RequiredArgsConstructor
public class TextReportRenderer {

    private static final int TOP_RULES = 10;

    private final ValidatorProperties properties;

    /**
     * @param verbose include advisory findings in the per-file listing
     */
    public String render(ValidationReport report, boolean verbose) {
        StringBuilder sb = new StringBuilder();
        ValidationReport.Totals totals = report.getSummary().getTotals();

        sb.append("Documentation Validation Report\n");
        sb.append("===============================\n\n");
        sb.append(String.format("Files validated:    %d\n", report.getFilesValidated()));
        sb.append(String.format("Files failing:      %d\n", totals.getFilesFailing()));
        sb.append(String.format("Files warning only: %d\n", totals.getFilesWarningOnly()));
        sb.append(String.format("Files passing:      %d\n", totals.getFilesPassing()));
        sb.append(String.format("Blocking findings:  %d\n", totals.getBlocking()));
        sb.append(String.format("Advisory findings:  %d\n", totals.getAdvisory()));

        appendWorstOffenders(sb, report);
        appendTopRules(sb, report);
        appendDuplicates(sb, report);
        appendListing(sb, report, verbose);

        sb.append("\n");
        sb.append(report.hasBlockingFindings()
            ? String.format("FAILED: %d blocking findings in %d files\n", totals.getBlocking(), totals.getFilesFailing())
            : "PASSED: no blocking findings\n");

        return sb.toString();
    }

    private void appendWorstOffenders(StringBuilder sb, ValidationReport report) {
        List<Map.Entry<String, ValidationReport.FileCounts>> offenders = report.getSummary().getByFile().entrySet()
            .stream()
            .filter(e -> e.getValue().getFailCount() + e.getValue().getWarnCount() > 0)
            .sorted(Comparator
                .comparing((Map.Entry<String, ValidationReport.FileCounts> e) -> e.getValue().getFailCount())
                .reversed()
                .thenComparing(e -> e.getValue().getWarnCount(), Comparator.reverseOrder())
                .thenComparing(Map.Entry::getKey))
            .limit(properties.getWorstOffenders())
            .toList();

        if (offenders.isEmpty()) {
            return;
        }

        sb.append("\nWorst offenders:\n");
        for (Map.Entry<String, ValidationReport.FileCounts> entry : offenders) {
            sb.append(String.format("  %-50s %3d blocking  %3d advisory\n",
                entry.getKey(), entry.getValue().getFailCount(), entry.getValue().getWarnCount()));
        }
    }

    private void appendTopRules(StringBuilder sb, ValidationReport report) {
        Map<String, Integer> byRule = report.getSummary().getByRule();
        if (byRule.isEmpty()) {
            return;
        }

        sb.append("\nFindings by rule:\n");
        byRule.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry::getKey))
            .limit(TOP_RULES)
            .forEach(e -> sb.append(String.format("  %-30s %d\n", e.getKey(), e.getValue())));
    }

    private void appendDuplicates(StringBuilder sb, ValidationReport report) {
        Map<String, List<String>> duplicates = report.getSummary().getDuplicateBasenames();
        if (duplicates.isEmpty()) {
            return;
        }

        sb.append("\nDuplicate basenames:\n");
        duplicates.forEach((basename, paths) -> {
            sb.append("  ").append(basename).append("\n");
            paths.forEach(path -> sb.append("    - ").append(path).append("\n"));
        });
    }

    private void appendListing(StringBuilder sb, ValidationReport report, boolean verbose) {
        List<Finding> listed = new ArrayList<>(report.getFailures());
        if (verbose) {
            listed.addAll(report.getWarnings());
        }
        if (listed.isEmpty()) {
            return;
        }
        listed.sort(Finding.REPORT_ORDER);

        Map<String, List<Finding>> byPath = new LinkedHashMap<>();
        for (Finding finding : listed) {
            byPath.computeIfAbsent(finding.getPath(), k -> new ArrayList<>()).add(finding);
        }

        sb.append(verbose ? "\nAll findings:\n" : "\nBlocking findings:\n");
        byPath.forEach((path, findings) -> {
            sb.append("\n").append(path).append("\n");
            for (Finding f : findings) {
                sb.append(String.format("  [%s] %s (%s): %s\n",
                    f.getSeverity().getLabel().toUpperCase(), f.getRule().getId(), f.getLocation(), f.getMessage()));
            }
        });

        if (!verbose && !report.getWarnings().isEmpty()) {
            sb.append(String.format("\n%d advisory findings hidden (use --verbose to list them)\n",
                report.getWarnings().size()));
        }
    }
}
