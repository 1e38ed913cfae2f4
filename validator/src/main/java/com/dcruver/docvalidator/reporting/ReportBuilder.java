package com.dcruver.docvalidator.reporting;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.ValidationRun;
import com.dcruver.docvalidator.domain.corpus.DuplicateBasenameRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the findings of a run into a {@link ValidationReport}.
 */
@Component
public class ReportBuilder {

    public ValidationReport build(ValidationRun run) {
        List<Finding> failures = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        Map<String, Integer> byRule = new TreeMap<>();
        Map<String, int[]> counts = new TreeMap<>();

        // Every validated file appears in by_file, clean ones with zero counts
        for (Document document : run.getDocuments()) {
            counts.put(document.getRelativePath(), new int[2]);
        }

        for (Finding finding : run.getFindings()) {
            (finding.isBlocking() ? failures : warnings).add(finding);
            byRule.merge(finding.getRule().getId(), 1, Integer::sum);

            // Cross-file findings count against every member file
            for (String path : finding.getAffectedPaths()) {
                int[] fileCounts = counts.computeIfAbsent(path, k -> new int[2]);
                fileCounts[finding.isBlocking() ? 0 : 1]++;
            }
        }

        Map<String, ValidationReport.FileCounts> byFile = new TreeMap<>();
        int failing = 0;
        int warningOnly = 0;
        for (Map.Entry<String, int[]> entry : counts.entrySet()) {
            int[] c = entry.getValue();
            byFile.put(entry.getKey(), ValidationReport.FileCounts.builder()
                .failCount(c[0])
                .warnCount(c[1])
                .build());
            if (c[0] > 0) {
                failing++;
            } else if (c[1] > 0) {
                warningOnly++;
            }
        }

        Map<String, List<String>> duplicates = new TreeMap<>();
        DuplicateBasenameRule.groupByBasename(run.getDocuments()).forEach((basename, paths) -> {
            if (paths.size() > 1) {
                duplicates.put(basename, paths);
            }
        });

        ValidationReport.Totals totals = ValidationReport.Totals.builder()
            .blocking(failures.size())
            .advisory(warnings.size())
            .filesFailing(failing)
            .filesWarningOnly(warningOnly)
            .filesPassing(counts.size() - failing - warningOnly)
            .build();

        return ValidationReport.builder()
            .filesValidated(run.getDocuments().size())
            .failures(List.copyOf(failures))
            .warnings(List.copyOf(warnings))
            .summary(ValidationReport.Summary.builder()
                .totals(totals)
                .byRule(byRule)
                .byFile(byFile)
                .duplicateBasenames(duplicates)
                .build())
            .build();
    }
}
