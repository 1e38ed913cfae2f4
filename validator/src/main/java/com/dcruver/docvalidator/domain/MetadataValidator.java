package com.dcruver.docvalidator.domain;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.config.ValidatorProperties.FieldSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks a metadata block against the configured schema.
 * Reports one finding per violated field and never stops at the first one.
 */
@Component
@RequiredArgsConstructor
public class MetadataValidator {

    private static final Pattern PERCENTAGE = Pattern.compile("^\\d+%$");
    private static final String LOCATION = "metadata";

    // "2024-01-15 10:00:00": only the separator right after the date may be a space
    private static final Pattern DATE_TIME_SPACE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) ");

    // 2024-01-15, 2024-01-15T10:00:00, 2024-01-15T10:00:00+02:00
    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter()
        .withChronology(IsoChronology.INSTANCE)
        .withResolverStyle(ResolverStyle.STRICT);

    private final ValidatorProperties properties;

    /**
     * @param metadata parsed metadata, empty when the block was missing or malformed
     * @param path     corpus-relative path the findings are reported against
     */
    public List<Finding> validate(Metadata metadata, String path) {
        List<Finding> findings = new ArrayList<>();

        for (Map.Entry<String, FieldSpec> entry : properties.getMetadata().resolvedFields().entrySet()) {
            String key = entry.getKey();
            FieldSpec spec = entry.getValue();

            if (!metadata.has(key)) {
                if (Boolean.TRUE.equals(spec.getRequired())) {
                    findings.add(finding(RuleId.METADATA_MISSING_FIELD, path,
                        String.format("Missing required metadata field \"%s\"", key)));
                }
                continue;
            }

            String problem = checkValue(spec, metadata.get(key));
            if (problem != null) {
                RuleId rule = spec.getKind() == FieldKind.ENUM
                    ? RuleId.METADATA_INVALID_ENUM
                    : RuleId.METADATA_INVALID_FORMAT;
                findings.add(finding(rule, path,
                    String.format("Invalid %s value %s: %s", key, describe(metadata.get(key)), problem)));
            }
        }

        return findings;
    }

    /**
     * @return description of the expected constraint, or null when the value conforms
     */
    private String checkValue(FieldSpec spec, Object value) {
        return switch (spec.getKind()) {
            case STRING -> isScalar(value) && !String.valueOf(value).isBlank()
                ? null
                : "expected a non-empty string";
            case ENUM -> value instanceof String s && spec.getValues().contains(s)
                ? null
                : "must be one of: " + String.join(", ", spec.getValues());
            case PERCENTAGE -> value != null && PERCENTAGE.matcher(String.valueOf(value)).matches()
                ? null
                : "must match pattern \\d+% (e.g. 85%)";
            case DATE -> value != null && isIsoDate(String.valueOf(value))
                ? null
                : "must be an ISO date (YYYY-MM-DD)";
            case STRING_LIST -> checkList(value);
        };
    }

    private String checkList(Object value) {
        if (!(value instanceof List<?> list)) {
            return "must be a list, got " + typeName(value);
        }
        if (list.isEmpty()) {
            return "list must not be empty";
        }
        for (Object element : list) {
            if (!isScalar(element) || String.valueOf(element).isBlank()) {
                return "every entry must be a non-empty string, got " + describe(element);
            }
        }
        return null;
    }

    private boolean isIsoDate(String value) {
        try {
            ISO_DATE_OR_DATE_TIME.parse(DATE_TIME_SPACE.matcher(value.trim()).replaceFirst("$1T"));
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "mapping";
        }
        return isScalar(value) ? "scalar" : value.getClass().getSimpleName();
    }

    private String describe(Object value) {
        return value == null ? "(empty)" : "\"" + value + "\"";
    }

    private Finding finding(RuleId rule, String path, String message) {
        return Finding.of(rule, path)
            .location(LOCATION)
            .line(1)
            .message(message)
            .build();
    }
}
