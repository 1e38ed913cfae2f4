package com.dcruver.docvalidator.reporting;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.ValidationRun;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static com.dcruver.docvalidator.TestDocuments.document;
import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    private final ReportBuilder builder = new ReportBuilder();

    private static final String BODY = "## Overview\nText.\n";

    private ValidationRun run(List<Document> documents, List<Finding> findings) {
        return ValidationRun.builder()
            .root(Path.of("docs"))
            .documents(documents)
            .findings(findings.stream().sorted(Finding.REPORT_ORDER).toList())
            .build();
    }

    @Test
    void testCountsAndPerFileStatus() {
        List<Document> documents = List.of(
            document("a/setup.md", BODY),
            document("b/setup.md", BODY),
            document("clean.md", BODY),
            document("warn.md", BODY));

        List<Finding> findings = List.of(
            Finding.of(RuleId.DUPLICATE_BASENAME, "a/setup.md")
                .message("dup")
                .relatedPaths(List.of("a/setup.md", "b/setup.md"))
                .build(),
            Finding.of(RuleId.SECTION_LENGTH, "a/setup.md").line(14).message("long").build(),
            Finding.of(RuleId.STUB_FILE, "warn.md").message("stub").build());

        ValidationReport report = builder.build(run(documents, findings));

        assertEquals(4, report.getFilesValidated());
        assertEquals(2, report.getFailures().size());
        assertEquals(1, report.getWarnings().size());

        ValidationReport.Totals totals = report.getSummary().getTotals();
        assertEquals(2, totals.getBlocking());
        assertEquals(1, totals.getAdvisory());
        assertEquals(2, totals.getFilesFailing());
        assertEquals(1, totals.getFilesWarningOnly());
        assertEquals(1, totals.getFilesPassing());

        // The duplicate counts against both members
        assertEquals(2, report.getSummary().getByFile().get("a/setup.md").getFailCount());
        assertEquals(1, report.getSummary().getByFile().get("b/setup.md").getFailCount());
        assertEquals(0, report.getSummary().getByFile().get("clean.md").getFailCount());
        assertEquals(1, report.getSummary().getByFile().get("warn.md").getWarnCount());

        assertEquals(1, report.getSummary().getByRule().get("duplicate-basename"));
        assertEquals(List.of("a/setup.md", "b/setup.md"),
            report.getSummary().getDuplicateBasenames().get("setup.md"));

        assertTrue(report.hasBlockingFindings());
        assertEquals(1, report.getExitCode());
    }

    @Test
    void testAdvisoryOnlyExitsClean() {
        ValidationReport report = builder.build(run(
            List.of(document("warn.md", BODY)),
            List.of(Finding.of(RuleId.PRONOUN_OPENING, "warn.md").line(14).message("It").build())));

        assertFalse(report.hasBlockingFindings());
        assertEquals(0, report.getExitCode());
        assertEquals(1, report.getSummary().getTotals().getFilesWarningOnly());
    }

    @Test
    void testEmptyRun() {
        ValidationReport report = builder.build(run(List.of(), List.of()));

        assertEquals(0, report.getFilesValidated());
        assertEquals(0, report.getExitCode());
        assertTrue(report.getSummary().getByFile().isEmpty());
        assertTrue(report.getSummary().getDuplicateBasenames().isEmpty());
    }
}
