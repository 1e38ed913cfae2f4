package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;

/**
 * Length diagnostics for one section in drill-down mode.
 */
@Data
@Builder
public class SectionMeasurement {
    private final String heading;
    private final int level;
    private final int line;
    private final int length;
    private final int limit;
    private final int subsections;
    private final int codeBlocks;

    public boolean isOverLimit() {
        return length > limit;
    }

    public int getExcess() {
        return Math.max(0, length - limit);
    }
}
