package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A fenced code block found inside a section.
 */
@Data
@Builder
public class CodeBlock {
    /**
     * Character offset of the opening fence line within the body
     */
    private final int offset;

    /**
     * File line number (1-based) of the opening fence
     */
    private final int line;

    /**
     * Number of lines between the fences
     */
    private final int lineCount;

    /**
     * Info string after the opening fence, empty when absent
     */
    private final String language;

    /**
     * Lines between the enclosing section's heading and the opening fence
     */
    private final int linesFromHeading;

    /**
     * Whether a prose line sits between the enclosing heading and this block
     */
    private final boolean proseBefore;

    /**
     * False when the body ended before a closing fence
     */
    private final boolean closed;
}
