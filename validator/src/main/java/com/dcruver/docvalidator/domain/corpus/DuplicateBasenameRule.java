package com.dcruver.docvalidator.domain.corpus;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flags filenames used by more than one document.
 * Retrieval attributes chunks by basename, so duplicates make sources ambiguous.
 * One finding per group, listing every member.
 */
@Component
@Order(10)
@Slf4j
public class DuplicateBasenameRule implements CorpusRule {

    @Override
    public String getName() {
        return "DuplicateBasename";
    }

    @Override
    public String getDescription() {
        return "Filenames must be unique across the corpus";
    }

    @Override
    public List<Finding> check(List<Document> corpus) {
        List<Finding> findings = new ArrayList<>();

        for (Map.Entry<String, List<String>> group : groupByBasename(corpus).entrySet()) {
            List<String> paths = group.getValue();
            if (paths.size() < 2) {
                continue;
            }

            log.debug("Duplicate basename {} shared by {}", group.getKey(), paths);
            findings.add(Finding.of(RuleId.DUPLICATE_BASENAME, paths.get(0))
                .message(String.format("Basename \"%s\" is shared by %d files: %s",
                    group.getKey(), paths.size(), String.join(", ", paths)))
                .relatedPaths(List.copyOf(paths))
                .build());
        }

        return findings;
    }

    /**
     * Basename to sorted member paths, in basename order
     */
    public static Map<String, List<String>> groupByBasename(List<Document> corpus) {
        Map<String, List<String>> groups = new TreeMap<>();
        for (Document document : corpus) {
            groups.computeIfAbsent(document.getBasename(), k -> new ArrayList<>())
                .add(document.getRelativePath());
        }
        groups.values().forEach(paths -> paths.sort(String::compareTo));
        return groups;
    }
}
