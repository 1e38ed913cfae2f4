package com.dcruver.docvalidator;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.SectionModelBuilder;
import com.dcruver.docvalidator.domain.corpus.CorpusRule;
import com.dcruver.docvalidator.domain.corpus.DuplicateBasenameRule;
import com.dcruver.docvalidator.domain.corpus.FileSizeRule;
import com.dcruver.docvalidator.domain.corpus.FilenameConventionRule;
import com.dcruver.docvalidator.domain.corpus.TrailingNewlineRule;
import com.dcruver.docvalidator.domain.rules.CodeBlockProseRule;
import com.dcruver.docvalidator.domain.rules.CodeBlockSubsectionRule;
import com.dcruver.docvalidator.domain.rules.DocumentRule;
import com.dcruver.docvalidator.domain.rules.EmptyHeadingRule;
import com.dcruver.docvalidator.domain.rules.HeadingSkipRule;
import com.dcruver.docvalidator.domain.rules.NoSectionsRule;
import com.dcruver.docvalidator.domain.rules.PronounOpeningRule;
import com.dcruver.docvalidator.domain.rules.SectionLengthRule;
import com.dcruver.docvalidator.domain.rules.UnclosedFenceRule;
import com.dcruver.docvalidator.io.DocumentLoader;

import java.nio.file.Path;
import java.util.List;

/**
 * Shared fixtures for building documents without touching the disk.
 */
public final class TestDocuments {

    // 13 lines, so the body starts on line 14
    public static final String VALID_METADATA = """
        ---
        title: Hot Reload in Next.js
        category: frontend
        subcategory: tooling
        tags: [nextjs, dev-server]
        stack: js-nextjs
        priority: high
        audience: frontend
        complexity: intermediate
        doc_type: guide
        source_confidence: 85%
        last_updated: 2024-01-15
        ---
        """;

    public static final int BODY_START_LINE = 14;

    private TestDocuments() {
    }

    public static DocumentLoader loader() {
        return new DocumentLoader(new SectionModelBuilder());
    }

    /**
     * Parse a document with valid metadata followed by the given body
     */
    public static Document document(String relativePath, String body) {
        return parse(relativePath, VALID_METADATA + body);
    }

    public static Document parse(String relativePath, String text) {
        return loader().parse(Path.of(relativePath), relativePath, text).getDocument();
    }

    /**
     * Fenced block with the given number of content lines
     */
    public static String codeBlock(String language, int lines) {
        StringBuilder sb = new StringBuilder("```").append(language).append("\n");
        for (int i = 1; i <= lines; i++) {
            sb.append("const value").append(i).append(" = ").append(i).append(";\n");
        }
        return sb.append("```\n").toString();
    }

    /**
     * Body of well-formed prose sections padding a file to roughly the given total line count
     */
    public static String paddedBody(int totalLines) {
        StringBuilder sb = new StringBuilder("## Overview\n\n");
        int lines = 13 + 2;
        int paragraph = 0;
        while (lines < totalLines) {
            sb.append("Prettier formats staged files before commit ").append(paragraph++).append(".\n");
            lines++;
        }
        return sb.toString();
    }

    public static List<DocumentRule> documentRules(ValidatorProperties properties) {
        return List.of(
            new NoSectionsRule(properties),
            new SectionLengthRule(properties),
            new HeadingSkipRule(),
            new EmptyHeadingRule(),
            new PronounOpeningRule(properties),
            new CodeBlockSubsectionRule(properties),
            new CodeBlockProseRule(),
            new UnclosedFenceRule());
    }

    public static List<CorpusRule> corpusRules(ValidatorProperties properties) {
        return List.of(
            new DuplicateBasenameRule(),
            new FilenameConventionRule(properties),
            new FileSizeRule(properties),
            new TrailingNewlineRule());
    }
}
