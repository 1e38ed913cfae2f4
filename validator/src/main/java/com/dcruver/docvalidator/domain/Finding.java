package com.dcruver.docvalidator.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.Comparator;
import java.util.List;

/**
 * One reported rule violation or advisory observation.
 * Never mutated after creation; severity changes produce a copy via {@code withSeverity}.
 */
@Data
@Builder
@With
@JsonPropertyOrder({"rule", "severity", "path", "location", "message", "related_paths"})
public class Finding {

    /**
     * Report order: path, then line (file-level findings first), then rule declaration order
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
        .comparing(Finding::getPath)
        .thenComparing(f -> f.getLine() != null ? f.getLine() : 0)
        .thenComparing(Finding::getRule)
        .thenComparing(Finding::getMessage);

    private final RuleId rule;
    private final Severity severity;

    // Corpus-relative path with forward slashes
    private final String path;

    // Section heading, "line N" or "file"
    private final String location;

    @JsonIgnore
    private final Integer line;

    private final String message;

    // Other files implicated by a cross-file finding (duplicate basenames)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("related_paths")
    private final List<String> relatedPaths;

    @JsonIgnore
    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    /**
     * Start a finding for a rule at its default severity
     */
    public static FindingBuilder of(RuleId rule, String path) {
        return Finding.builder()
            .rule(rule)
            .severity(rule.getDefaultSeverity())
            .path(path)
            .location("file")
            .relatedPaths(List.of());
    }

    /**
     * Files this finding counts against. Cross-file findings list every member in related paths.
     */
    @JsonIgnore
    public List<String> getAffectedPaths() {
        if (relatedPaths == null || relatedPaths.isEmpty()) {
            return List.of(path);
        }
        return relatedPaths;
    }
}
