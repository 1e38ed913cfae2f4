package com.dcruver.docvalidator.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a document body into a {@link SectionTree}.
 *
 * Boundaries follow the downstream chunk splitter: a heading of level L closes every
 * open section of level &gt;= L, so a section's span includes all of its descendants.
 * Lines inside fenced code blocks are never treated as headings.
 */
@Component
@Slf4j
public class SectionModelBuilder {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})(?:[ \\t]+(.*?))?(?:[ \\t]+#+)?[ \\t]*$");
    private static final Pattern FENCE_OPEN = Pattern.compile("^ {0,3}(`{3,}|~{3,})[ \\t]*([^`]*?)[ \\t]*$");
    private static final Pattern FENCE_CLOSE = Pattern.compile("^ {0,3}(`{3,}|~{3,})[ \\t]*$");

    /**
     * Build the section tree for a body.
     *
     * @param body      document text after the metadata block
     * @param firstLine file line number of the body's first line
     */
    public SectionTree build(String body, int firstLine) {
        String[] lines = body.split("\n", -1);

        Deque<OpenSection> stack = new ArrayDeque<>();
        stack.push(new OpenSection(0, null, firstLine, 0, 0));

        OpenFence fence = null;
        Section root = null;
        int offset = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = stripCarriageReturn(lines[i]);
            int lineNumber = firstLine + i;
            int nextOffset = offset + lines[i].length() + (i < lines.length - 1 ? 1 : 0);

            if (fence != null) {
                if (fence.isClosedBy(line)) {
                    fence.owner.codeBlocks.add(fence.toCodeBlock(true));
                    fence = null;
                } else {
                    fence.contentLines++;
                }
                offset = nextOffset;
                continue;
            }

            Matcher heading = HEADING.matcher(line);
            Matcher fenceOpen = FENCE_OPEN.matcher(line);

            if (heading.matches()) {
                int level = heading.group(1).length();
                String title = heading.group(2) != null ? heading.group(2).trim() : "";

                while (stack.peek().level >= level) {
                    close(stack.pop(), offset, body, stack);
                }
                stack.push(new OpenSection(level, title, lineNumber, offset, nextOffset));

            } else if (fenceOpen.matches()) {
                OpenSection owner = stack.peek();
                owner.openingSettled = true;
                fence = new OpenFence(owner, fenceOpen.group(1), fenceOpen.group(2), offset, lineNumber);

            } else if (!line.isBlank()) {
                OpenSection current = stack.peek();
                current.proseSeen = true;
                if (!current.openingSettled) {
                    current.openingLine = line.trim();
                    current.openingSettled = true;
                }
            }

            offset = nextOffset;
        }

        if (fence != null) {
            log.debug("Unclosed code fence opened at line {}", fence.line);
            fence.owner.codeBlocks.add(fence.toCodeBlock(false));
        }

        while (!stack.isEmpty()) {
            OpenSection open = stack.pop();
            Section closed = close(open, body.length(), body, stack);
            if (open.level == 0) {
                root = closed;
            }
        }

        return new SectionTree(root, body.length());
    }

    /**
     * Finalize a section at the given end offset and attach it to its parent
     */
    private Section close(OpenSection open, int end, String body, Deque<OpenSection> stack) {
        Section section = Section.builder()
            .level(open.level)
            .heading(open.heading)
            .line(open.line)
            .headingOffset(open.headingOffset)
            .contentStart(open.contentStart)
            .end(end)
            .openingLine(open.openingLine)
            .contentBlank(body.substring(open.contentStart, end).isBlank())
            .codeBlocks(List.copyOf(open.codeBlocks))
            .children(List.copyOf(open.children))
            .build();

        OpenSection parent = stack.peek();
        if (parent != null) {
            parent.children.add(section);
        }
        return section;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Section still accepting lines
     */
    private static class OpenSection {
        private final int level;
        private final String heading;
        private final int line;
        private final int headingOffset;
        private final int contentStart;
        private final List<Section> children = new ArrayList<>();
        private final List<CodeBlock> codeBlocks = new ArrayList<>();
        private boolean proseSeen;
        private boolean openingSettled;
        private String openingLine;

        OpenSection(int level, String heading, int line, int headingOffset, int contentStart) {
            this.level = level;
            this.heading = heading;
            this.line = line;
            this.headingOffset = headingOffset;
            this.contentStart = contentStart;
        }
    }

    /**
     * Code fence awaiting its closing line
     */
    private static class OpenFence {
        private final OpenSection owner;
        private final String marker;
        private final String language;
        private final int offset;
        private final int line;
        private final boolean proseBefore;
        private int contentLines;

        OpenFence(OpenSection owner, String marker, String language, int offset, int line) {
            this.owner = owner;
            this.marker = marker;
            this.language = language != null ? language : "";
            this.offset = offset;
            this.line = line;
            this.proseBefore = owner.proseSeen;
        }

        boolean isClosedBy(String candidate) {
            Matcher close = FENCE_CLOSE.matcher(candidate);
            return close.matches()
                && close.group(1).charAt(0) == marker.charAt(0)
                && close.group(1).length() >= marker.length();
        }

        CodeBlock toCodeBlock(boolean closed) {
            return CodeBlock.builder()
                .offset(offset)
                .line(line)
                .lineCount(contentLines)
                .language(language)
                .linesFromHeading(line - owner.line)
                .proseBefore(proseBefore)
                .closed(closed)
                .build();
        }
    }
}
