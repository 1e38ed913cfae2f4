package com.dcruver.docvalidator.domain;

import com.dcruver.docvalidator.TestCorpus;
import com.dcruver.docvalidator.TestDocuments;
import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.rules.SectionLengthRule;
import com.dcruver.docvalidator.io.InvalidInvocationException;
import com.dcruver.docvalidator.reporting.SectionReportRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for single-document drill-down.
 */
class SectionAnalyzerTest {

    @TempDir
    Path tempDir;

    private SectionAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        ValidatorProperties properties = new ValidatorProperties();
        analyzer = new SectionAnalyzer(TestDocuments.loader(), new SectionLengthRule(properties), properties);
    }

    @Test
    void testMeasuresEverySection() throws Exception {
        Path file = TestCorpus.write(tempDir, "routing.md", TestDocuments.VALID_METADATA
            + "## App Router\nRoutes live in the app directory.\n"
            + "### Layouts\nShared UI.\n" + "l".repeat(900) + "\n"
            + "### Loading\nSuspense boundaries:\n" + TestDocuments.codeBlock("tsx", 3) + "s".repeat(700) + "\n"
            + "## Pages Router\nLegacy routing.\n");

        SectionAnalysis analysis = analyzer.analyze(file);

        assertEquals(4, analysis.getSections().size());
        assertEquals(1, analysis.getFailingCount());

        SectionMeasurement appRouter = analysis.getSections().get(0);
        assertEquals("## App Router", appRouter.getHeading());
        assertTrue(appRouter.isOverLimit());
        assertEquals(appRouter.getLength() - 1500, appRouter.getExcess());
        assertEquals(2, appRouter.getSubsections());
        assertEquals(1, appRouter.getCodeBlocks());

        assertFalse(analysis.getSections().get(1).isOverLimit());
        assertEquals(0, analysis.getSections().get(1).getExcess());
    }

    @Test
    void testRenderedOutput() throws Exception {
        Path file = TestCorpus.write(tempDir, "big.md", TestDocuments.VALID_METADATA
            + "## Big\nIntro.\n### Part\n" + "p".repeat(1600) + "\n## Small\nShort.\n");

        String output = new SectionReportRenderer().render(analyzer.analyze(file));

        assertTrue(output.contains("## Big: "));
        assertTrue(output.contains("FAIL"));
        assertTrue(output.contains("1 subsections, 0 code blocks"));
        assertTrue(output.contains("## Small: 7 chars ok"));
        assertTrue(output.endsWith("2/3 sections exceed the limit\n"), output);
    }

    @Test
    void testMissingMetadataStillAnalyzed() throws Exception {
        Path file = TestCorpus.write(tempDir, "draft.md", "## Draft\nWork in progress.\n");

        SectionAnalysis analysis = analyzer.analyze(file);

        assertEquals(1, analysis.getSections().size());
        assertEquals(RuleId.MISSING_METADATA_BLOCK, analysis.getLoadFindings().get(0).getRule());
    }

    @Test
    void testMissingFileIsInvalidInvocation() {
        assertThrows(InvalidInvocationException.class, () -> analyzer.analyze(tempDir.resolve("nope.md")));
    }

    @Test
    void testUndecodableFileIsInvalidInvocation() throws Exception {
        Path file = Files.write(tempDir.resolve("latin1.md"), new byte[]{'#', '#', ' ', (byte) 0xE9, '\n'});

        InvalidInvocationException e = assertThrows(InvalidInvocationException.class, () -> analyzer.analyze(file));
        assertTrue(e.getMessage().contains("not valid UTF-8"));
    }
}
