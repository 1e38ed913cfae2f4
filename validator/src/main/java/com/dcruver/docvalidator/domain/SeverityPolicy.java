package com.dcruver.docvalidator.domain;

import com.dcruver.docvalidator.config.ValidatorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies configured severity overrides and disabled rules to raw findings.
 * Rules always emit their default severity; policy is decided here.
 */
@Component
@RequiredArgsConstructor
public class SeverityPolicy {

    private final ValidatorProperties properties;

    public Severity severityOf(RuleId rule) {
        return properties.getSeverityOverrides().getOrDefault(rule, rule.getDefaultSeverity());
    }

    public boolean isEnabled(RuleId rule) {
        return !properties.getDisabledRules().contains(rule);
    }

    public List<Finding> apply(List<Finding> findings) {
        return findings.stream()
            .filter(finding -> isEnabled(finding.getRule()))
            .map(finding -> finding.withSeverity(severityOf(finding.getRule())))
            .toList();
    }
}
