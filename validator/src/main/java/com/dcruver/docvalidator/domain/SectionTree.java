package com.dcruver.docvalidator.domain;

import lombok.Data;

import java.util.List;

/**
 * Heading hierarchy of one document body.
 */
@Data
public class SectionTree {
    private final Section root;
    private final int bodyLength;

    /**
     * Every real heading section in document order (root excluded)
     */
    public List<Section> getSections() {
        return root.flatten()
            .filter(section -> !section.isRoot())
            .toList();
    }

    /**
     * Root plus every section, for checks that also apply to text before the first heading
     */
    public List<Section> getAllSections() {
        return root.flatten().toList();
    }

    public boolean hasSectionAtLevel(int level) {
        return root.flatten().anyMatch(section -> section.getLevel() == level);
    }
}
