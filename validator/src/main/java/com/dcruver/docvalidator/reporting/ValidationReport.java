package com.dcruver.docvalidator.reporting;

import com.dcruver.docvalidator.domain.Finding;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Aggregated result of one validation run, serialized as the structured report.
 * Every map is sorted and nothing time-dependent is recorded, so unchanged input gives identical output.
 */
@Data
@Builder
@JsonPropertyOrder({"files_validated", "failures", "warnings", "summary"})
public class ValidationReport {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_BLOCKING = 1;

    @JsonProperty("files_validated")
    private final int filesValidated;

    // Blocking findings in report order
    private final List<Finding> failures;

    // Advisory findings in report order
    private final List<Finding> warnings;

    private final Summary summary;

    @JsonIgnore
    public boolean hasBlockingFindings() {
        return !failures.isEmpty();
    }

    /**
     * 0 when nothing blocking was found, 1 otherwise. Advisory findings never change it.
     */
    @JsonIgnore
    public int getExitCode() {
        return hasBlockingFindings() ? EXIT_BLOCKING : EXIT_CLEAN;
    }

    @Data
    @Builder
    @JsonPropertyOrder({"totals", "by_rule", "by_file", "duplicate_basenames"})
    public static class Summary {
        private final Totals totals;

        @JsonProperty("by_rule")
        private final Map<String, Integer> byRule;

        @JsonProperty("by_file")
        private final Map<String, FileCounts> byFile;

        @JsonProperty("duplicate_basenames")
        private final Map<String, List<String>> duplicateBasenames;
    }

    @Data
    @Builder
    @JsonPropertyOrder({"blocking", "advisory", "files_failing", "files_warning_only", "files_passing"})
    public static class Totals {
        private final int blocking;
        private final int advisory;

        @JsonProperty("files_failing")
        private final int filesFailing;

        @JsonProperty("files_warning_only")
        private final int filesWarningOnly;

        @JsonProperty("files_passing")
        private final int filesPassing;
    }

    @Data
    @Builder
    @JsonPropertyOrder({"fail_count", "warn_count"})
    public static class FileCounts {
        @JsonProperty("fail_count")
        private final int failCount;

        @JsonProperty("warn_count")
        private final int warnCount;
    }
}
