package com.dcruver.docvalidator.config;

import com.dcruver.docvalidator.domain.FieldKind;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thresholds, metadata schema and severity policy for a validation run.
 * Defaults match the documentation quality rules; every value can be overridden
 * under the {@code validator} prefix.
 */
@Component
@ConfigurationProperties(prefix = "validator")
@Data
public class ValidatorProperties {

    private String docsDir = "docs";
    private List<String> extensions = new ArrayList<>(List.of(".md"));
    private List<String> excludedDirs = new ArrayList<>(List.of(".git", "node_modules"));

    // Phase 1 worker threads
    private int parallelism = 4;

    private int maxSectionLength = 1500;
    private int maxCheckedLevel = 4;
    private int longCodeBlockLines = 10;
    private int stubLineCount = 80;
    private int oversizedLineCount = 600;

    private List<String> discouragedOpeners = new ArrayList<>(List.of("It", "This", "These", "They", "That", "We"));
    private String filenamePattern = "^[a-z0-9]+(-[a-z0-9]+)*$";
    private boolean requireSections = true;

    // Files listed in the triage block of the text report
    private int worstOffenders = 10;

    private Map<RuleId, Severity> severityOverrides = new LinkedHashMap<>();
    private Set<RuleId> disabledRules = new LinkedHashSet<>();

    private MetadataSchema metadata = new MetadataSchema();

    /**
     * Required metadata keys in report order.
     * Binding a single attribute of a built-in key (e.g. {@code fields[doc_type].required=false})
     * keeps that key's other built-in attributes; see {@link #resolvedFields()}.
     */
    @Data
    public static class MetadataSchema {
        private Map<String, FieldSpec> fields = defaultFields();

        /**
         * Fields with every unset attribute filled from the built-in default for that key.
         * Keys without a built-in default are required free strings unless configured otherwise.
         */
        public Map<String, FieldSpec> resolvedFields() {
            Map<String, FieldSpec> defaults = defaultFields();
            Map<String, FieldSpec> resolved = new LinkedHashMap<>();
            fields.forEach((key, spec) ->
                resolved.put(key, spec.withDefaults(defaults.getOrDefault(key, FieldSpec.of(FieldKind.STRING)))));
            return resolved;
        }

        private static Map<String, FieldSpec> defaultFields() {
            Map<String, FieldSpec> fields = new LinkedHashMap<>();
            fields.put("title", FieldSpec.of(FieldKind.STRING));
            fields.put("category", FieldSpec.of(FieldKind.STRING));
            fields.put("subcategory", FieldSpec.of(FieldKind.STRING));
            fields.put("tags", FieldSpec.of(FieldKind.STRING_LIST));
            fields.put("stack", FieldSpec.oneOf("js-nextjs", "sanity", "php-wp", "cross-stack"));
            fields.put("priority", FieldSpec.oneOf("high", "medium", "low"));
            fields.put("audience", FieldSpec.oneOf("frontend", "backend", "fullstack"));
            fields.put("complexity", FieldSpec.oneOf("beginner", "intermediate", "advanced"));
            fields.put("doc_type", FieldSpec.oneOf("standard", "guide", "reference", "decision"));
            fields.put("source_confidence", FieldSpec.of(FieldKind.PERCENTAGE));
            fields.put("last_updated", FieldSpec.of(FieldKind.DATE));
            return fields;
        }
    }

    /**
     * Contract for a single metadata key. A null attribute means "not configured".
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldSpec {
        private FieldKind kind;
        private List<String> values;
        private Boolean required;

        public static FieldSpec of(FieldKind kind) {
            return new FieldSpec(kind, new ArrayList<>(), true);
        }

        public static FieldSpec oneOf(String... values) {
            return new FieldSpec(FieldKind.ENUM, new ArrayList<>(List.of(values)), true);
        }

        /**
         * Copy with unset attributes taken from the fallback
         */
        public FieldSpec withDefaults(FieldSpec fallback) {
            return new FieldSpec(
                kind != null ? kind : fallback.getKind(),
                values != null ? List.copyOf(values) : List.copyOf(fallback.getValues()),
                required != null ? required : fallback.getRequired());
        }
    }
}
