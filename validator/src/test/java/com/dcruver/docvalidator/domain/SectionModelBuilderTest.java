package com.dcruver.docvalidator.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for section boundaries, nesting and code block attribution.
 */
class SectionModelBuilderTest {

    private SectionModelBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SectionModelBuilder();
    }

    @Test
    void testNestingAndEffectiveLength() {
        String body = """
            ## A
            Intro text.
            ### B
            Detail.
            ## C
            Last.
            """;

        SectionTree tree = builder.build(body, 1);
        List<Section> sections = tree.getSections();

        assertEquals(3, sections.size());
        Section a = sections.get(0);
        Section b = sections.get(1);
        Section c = sections.get(2);

        assertEquals("A", a.getHeading());
        assertEquals(2, a.getLevel());
        assertEquals(1, a.getLine());
        assertEquals(List.of(b), a.getChildren());

        // A's span runs up to "## C" and includes its child
        assertEquals("Intro text.\n### B\nDetail.\n".length(), a.getEffectiveLength());
        assertEquals("Detail.\n".length(), b.getEffectiveLength());
        assertEquals("Last.\n".length(), c.getEffectiveLength());
        assertEquals(3, b.getLine());
        assertEquals(5, c.getLine());
    }

    @Test
    void testLineNumbersStartAtFirstLine() {
        SectionTree tree = builder.build("\n## Setup\ntext\n", 14);

        assertEquals(15, tree.getSections().get(0).getLine());
        assertEquals(14, tree.getRoot().getLine());
    }

    @Test
    void testHeadingInsideFenceIgnored() {
        String body = """
            ## Setup
            Run this:
            ```bash
            # not a heading
            echo hi
            ```
            """;

        SectionTree tree = builder.build(body, 1);

        assertEquals(1, tree.getSections().size());
        List<CodeBlock> blocks = tree.getSections().get(0).getCodeBlocks();
        assertEquals(1, blocks.size());

        CodeBlock block = blocks.get(0);
        assertEquals("bash", block.getLanguage());
        assertEquals(2, block.getLineCount());
        assertEquals(3, block.getLine());
        assertEquals(2, block.getLinesFromHeading());
        assertTrue(block.isProseBefore());
        assertTrue(block.isClosed());
    }

    @Test
    void testTildeFenceNotClosedByBackticks() {
        String body = """
            ## Setup
            Example:
            ~~~
            ```
            ## still code
            ~~~
            ## Next
            Text.
            """;

        SectionTree tree = builder.build(body, 1);

        assertEquals(2, tree.getSections().size());
        assertEquals(2, tree.getSections().get(0).getCodeBlocks().get(0).getLineCount());
    }

    @Test
    void testUnclosedFenceRunsToEnd() {
        String body = """
            ## Setup
            Example:
            ```js
            const a = 1;
            ## swallowed
            """;

        SectionTree tree = builder.build(body, 1);

        assertEquals(1, tree.getSections().size());
        CodeBlock block = tree.getSections().get(0).getCodeBlocks().get(0);
        assertFalse(block.isClosed());
    }

    @Test
    void testCodeBlockBeforeFirstHeadingBelongsToRoot() {
        String body = """
            ```
            npm install
            ```
            ## Usage
            Text.
            """;

        SectionTree tree = builder.build(body, 1);

        assertEquals(1, tree.getRoot().getCodeBlocks().size());
        assertFalse(tree.getRoot().getCodeBlocks().get(0).isProseBefore());
        assertTrue(tree.getSections().get(0).getCodeBlocks().isEmpty());
    }

    @Test
    void testOpeningLine() {
        String body = """
            ## First

            It works out of the box.
            More text.
            ## Second
            ```
            code
            ```
            Then prose.
            ## Third
            ### Child
            Child text.
            """;

        List<Section> sections = builder.build(body, 1).getSections();

        assertEquals("It works out of the box.", sections.get(0).getOpeningLine());
        assertNull(sections.get(1).getOpeningLine(), "Section opening with a fence has no opening line");
        assertNull(sections.get(2).getOpeningLine(), "Child heading text is not the parent's opening");
        assertEquals("Child text.", sections.get(3).getOpeningLine());
    }

    @Test
    void testHeadingVariants() {
        String body = "## Closed Title ##\ntext\n#hashtag is prose\n##\n\n## Windows\r\nline\r\n";

        List<Section> sections = builder.build(body, 1).getSections();

        assertEquals(3, sections.size());
        assertEquals("Closed Title", sections.get(0).getHeading());
        assertEquals("", sections.get(1).getHeading());
        assertTrue(sections.get(1).isContentBlank());
        assertEquals("Windows", sections.get(2).getHeading());
        assertEquals("## Windows", sections.get(2).getDisplayHeading());
    }

    @Test
    void testCountCodeBlocksInSpanIncludesDescendants() {
        String body = """
            ## Parent
            Intro:
            ```
            a
            ```
            ### Child
            More:
            ```
            b
            ```
            """;

        Section parent = builder.build(body, 1).getSections().get(0);

        assertEquals(1, parent.getCodeBlocks().size());
        assertEquals(2, parent.countCodeBlocksInSpan());
    }

    @Test
    void testEmptyBody() {
        SectionTree tree = builder.build("", 1);

        assertTrue(tree.getSections().isEmpty());
        assertFalse(tree.hasSectionAtLevel(2));
        assertEquals(0, tree.getBodyLength());
    }
}
