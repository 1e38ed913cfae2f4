package com.dcruver.docvalidator.domain;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.List;
import java.util.stream.Stream;

/**
 * A heading and everything beneath it up to the next heading of the same or a shallower level.
 * The implicit root has level 0, no heading, and spans the whole body.
 */
@Data
@Builder
public class Section {
    private final int level;
    private final String heading;

    // File line of the heading (body start line for the root)
    private final int line;

    // Offsets into the body
    private final int headingOffset;
    private final int contentStart;
    private final int end;

    /**
     * First non-blank prose line directly under the heading, null if the section
     * opens with a code fence, a child heading, or has no text at all
     */
    private final String openingLine;

    /**
     * True when nothing but whitespace sits between the heading and the section end
     */
    private final boolean contentBlank;

    // Blocks whose innermost enclosing section is this one
    private final List<CodeBlock> codeBlocks;

    @ToString.Exclude
    private final List<Section> children;

    public boolean isRoot() {
        return level == 0;
    }

    /**
     * Span from just after the heading line to just before the next heading of level &lt;= this one.
     * Includes every descendant section, which is what the chunk splitter embeds as one unit.
     */
    public int getEffectiveLength() {
        return end - contentStart;
    }

    /**
     * Heading as written, e.g. "## Installation"
     */
    public String getDisplayHeading() {
        if (isRoot()) {
            return "(document)";
        }
        return "#".repeat(level) + " " + heading;
    }

    /**
     * This section followed by all descendants in document order
     */
    public Stream<Section> flatten() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Section::flatten));
    }

    /**
     * Code blocks of this section and all of its descendants
     */
    public int countCodeBlocksInSpan() {
        return flatten().mapToInt(s -> s.getCodeBlocks().size()).sum();
    }
}
