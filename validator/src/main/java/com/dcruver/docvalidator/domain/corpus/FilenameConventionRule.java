package com.dcruver.docvalidator.domain.corpus;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.RuleId;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Basenames (without extension) must be lowercase words joined by hyphens.
 */
@Component
@Order(20)
public class FilenameConventionRule implements CorpusRule {

    private final Pattern filenamePattern;

    public FilenameConventionRule(ValidatorProperties properties) {
        this.filenamePattern = Pattern.compile(properties.getFilenamePattern());
    }

    @Override
    public String getName() {
        return "FilenameConvention";
    }

    @Override
    public String getDescription() {
        return "Filenames must be lowercase-kebab-case";
    }

    @Override
    public List<Finding> check(List<Document> corpus) {
        return corpus.stream()
            .filter(document -> !filenamePattern.matcher(stem(document.getBasename())).matches())
            .map(document -> Finding.of(RuleId.FILENAME_CONVENTION, document.getRelativePath())
                .message(String.format("Filename \"%s\" is not lowercase-kebab-case",
                    stem(document.getBasename())))
                .build())
            .toList();
    }

    static String stem(String basename) {
        int dot = basename.lastIndexOf('.');
        return dot > 0 ? basename.substring(0, dot) : basename;
    }
}
