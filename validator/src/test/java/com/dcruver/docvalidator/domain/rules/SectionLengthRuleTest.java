package com.dcruver.docvalidator.domain.rules;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dcruver.docvalidator.TestDocuments.document;
import static org.junit.jupiter.api.Assertions.*;

class SectionLengthRuleTest {

    private SectionLengthRule rule;

    @BeforeEach
    void setUp() {
        rule = new SectionLengthRule(new ValidatorProperties());
    }

    @Test
    void testOversizedSectionReportedOnce() {
        // 1600 characters plus the newline
        Document doc = document("big.md", "## Big\n" + "x".repeat(1600) + "\n## Small\nShort.\n");

        List<Finding> findings = rule.check(doc);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(RuleId.SECTION_LENGTH, finding.getRule());
        assertTrue(finding.isBlocking());
        assertEquals("## Big", finding.getLocation());
        assertTrue(finding.getMessage().contains("1601 characters"), finding.getMessage());
        assertTrue(finding.getMessage().contains("limit 1500"));
        assertTrue(finding.getMessage().contains("101 over"));
    }

    @Test
    void testExactlyAtLimitPasses() {
        Document doc = document("edge.md", "## Edge\n" + "x".repeat(1499) + "\n");

        assertTrue(rule.check(doc).isEmpty());
    }

    @Test
    void testParentLengthIncludesChildren() {
        // Neither child is over the limit on its own, but together they make the parent too long
        String body = "## Parent\nIntro.\n"
            + "### One\n" + "a".repeat(800) + "\n"
            + "### Two\n" + "b".repeat(800) + "\n";

        List<Finding> findings = rule.check(document("nested.md", body));

        assertEquals(1, findings.size());
        assertEquals("## Parent", findings.get(0).getLocation());
    }

    @Test
    void testNestedSectionsMeasuredSeparately() {
        String body = "## Parent\n### Child\n" + "y".repeat(1600) + "\n";

        List<Finding> findings = rule.check(document("nested.md", body));

        assertEquals(2, findings.size());
        assertEquals("## Parent", findings.get(0).getLocation());
        assertEquals("### Child", findings.get(1).getLocation());
    }

    @Test
    void testDeepLevelsNotChecked() {
        String body = "## Parent\nIntro.\n### A\nText.\n#### B\nText.\n##### Deep\n" + "z".repeat(1600) + "\n";

        List<Finding> findings = rule.check(document("deep.md", body));

        // Level 5 is beyond the checked levels; its ancestors still carry its text
        assertEquals(3, findings.size());
        assertTrue(findings.stream().noneMatch(f -> f.getLocation().startsWith("#####")));
    }
}
