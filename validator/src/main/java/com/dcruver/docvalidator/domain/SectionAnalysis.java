package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Drill-down result for a single document.
 */
@Data
@Builder
public class SectionAnalysis {
    private final String path;
    private final int limit;
    private final List<SectionMeasurement> sections;

    // Load problems (missing or broken metadata block); sections are still measured
    private final List<Finding> loadFindings;

    public long getFailingCount() {
        return sections.stream().filter(SectionMeasurement::isOverLimit).count();
    }
}
