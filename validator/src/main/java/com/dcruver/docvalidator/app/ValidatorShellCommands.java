package com.dcruver.docvalidator.app;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.CorpusValidator;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.SectionAnalysis;
import com.dcruver.docvalidator.domain.SectionAnalyzer;
import com.dcruver.docvalidator.domain.SeverityPolicy;
import com.dcruver.docvalidator.domain.ValidationRun;
import com.dcruver.docvalidator.io.InvalidInvocationException;
import com.dcruver.docvalidator.reporting.JsonReportWriter;
import com.dcruver.docvalidator.reporting.ReportBuilder;
import com.dcruver.docvalidator.reporting.SectionReportRenderer;
import com.dcruver.docvalidator.reporting.TextReportRenderer;
import com.dcruver.docvalidator.reporting.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Spring Shell commands for the documentation validator.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class ValidatorShellCommands {

    private final CorpusValidator corpusValidator;
    private final SectionAnalyzer sectionAnalyzer;
    private final ReportBuilder reportBuilder;
    private final TextReportRenderer textRenderer;
    private final JsonReportWriter jsonWriter;
    private final SectionReportRenderer sectionRenderer;
    private final SeverityPolicy severityPolicy;
    private final ValidatorProperties properties;
    private final ValidationExitStatus exitStatus;

    @ShellMethod(key = {"validate", "check"}, value = "Validate every document under the docs directory")
    public String validate(
            @ShellOption(value = "--docs-dir", defaultValue = ShellOption.NULL,
                help = "Corpus root (defaults to validator.docs-dir)") String docsDir,
            @ShellOption(value = "--json", defaultValue = "false",
                help = "Print the report as JSON") boolean json,
            @ShellOption(value = "--report-file", defaultValue = ShellOption.NULL,
                help = "Also write the JSON report to this file") String reportFile,
            @ShellOption(value = "--verbose", defaultValue = "false",
                help = "List advisory findings too") boolean verbose) {

        Path root = Paths.get(docsDir != null ? docsDir : properties.getDocsDir());
        log.info("Validating documents under {}", root);

        try {
            ValidationRun run = corpusValidator.validate(root);
            ValidationReport report = reportBuilder.build(run);

            if (reportFile != null) {
                jsonWriter.write(report, Paths.get(reportFile));
            }

            exitStatus.set(report.getExitCode());
            return json ? jsonWriter.toJson(report) : textRenderer.render(report, verbose);

        } catch (InvalidInvocationException e) {
            log.error("Invalid invocation: {}", e.getMessage());
            exitStatus.set(ValidationExitStatus.INVALID_INVOCATION);
            return "Validation failed: " + e.getMessage();
        } catch (Exception e) {
            log.error("Validation failed", e);
            exitStatus.set(ValidationExitStatus.INVALID_INVOCATION);
            return "Validation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"analyze", "sections"}, value = "Show per-section lengths for one document")
    public String analyze(@ShellOption(help = "Document to analyze") String file) {
        log.info("Analyzing sections of {}", file);

        try {
            SectionAnalysis analysis = sectionAnalyzer.analyze(Paths.get(file));
            exitStatus.set(analysis.getFailingCount() > 0 ? ValidationReport.EXIT_BLOCKING : ValidationReport.EXIT_CLEAN);
            return sectionRenderer.render(analysis);

        } catch (InvalidInvocationException e) {
            log.error("Invalid invocation: {}", e.getMessage());
            exitStatus.set(ValidationExitStatus.INVALID_INVOCATION);
            return "Analysis failed: " + e.getMessage();
        } catch (Exception e) {
            log.error("Analysis failed", e);
            exitStatus.set(ValidationExitStatus.INVALID_INVOCATION);
            return "Analysis failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "rules", value = "List every rule with its effective severity")
    public String rules() {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation rules:\n\n");

        for (RuleId rule : RuleId.values()) {
            String state = severityPolicy.isEnabled(rule)
                ? severityPolicy.severityOf(rule).getLabel()
                : "disabled";
            String marker = severityPolicy.severityOf(rule) != rule.getDefaultSeverity() ? " (overridden)" : "";
            sb.append(String.format("  %-30s %s%s\n", rule.getId(), state, marker));
        }

        sb.append("\nPer-document checks:\n");
        corpusValidator.getDocumentRules().forEach(check ->
            sb.append(String.format("  %-22s %s\n", check.getName(), check.getDescription())));

        sb.append("\nCorpus checks:\n");
        corpusValidator.getCorpusRules().forEach(check ->
            sb.append(String.format("  %-22s %s\n", check.getName(), check.getDescription())));

        exitStatus.set(ValidationReport.EXIT_CLEAN);
        return sb.toString();
    }
}
