package com.dcruver.docvalidator.domain;

import com.dcruver.docvalidator.config.ValidatorProperties;
import com.dcruver.docvalidator.domain.rules.SectionLengthRule;
import com.dcruver.docvalidator.io.DocumentLoader;
import com.dcruver.docvalidator.io.InvalidInvocationException;
import com.dcruver.docvalidator.io.LoadedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Single-document drill-down: loads one file and measures every section the length check covers.
 * No corpus-level checks run here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SectionAnalyzer {

    private final DocumentLoader loader;
    private final SectionLengthRule lengthRule;
    private final ValidatorProperties properties;

    /**
     * @throws InvalidInvocationException if the file does not exist or cannot be read
     */
    public SectionAnalysis analyze(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidInvocationException(file, "File not found: " + file);
        }

        String displayPath = file.toString().replace('\\', '/');
        LoadedDocument loaded = loader.load(file, displayPath);
        Document document = loaded.getDocument();

        if (!document.isReadable()) {
            String reason = loaded.getFindings().isEmpty()
                ? "unreadable"
                : loaded.getFindings().get(0).getMessage();
            throw new InvalidInvocationException(file, "Cannot analyze " + displayPath + ": " + reason);
        }

        int limit = properties.getMaxSectionLength();
        List<SectionMeasurement> measurements = document.getSections().getSections().stream()
            .filter(lengthRule::isChecked)
            .map(section -> measure(section, limit))
            .toList();

        log.debug("Measured {} sections in {}", measurements.size(), displayPath);

        return SectionAnalysis.builder()
            .path(displayPath)
            .limit(limit)
            .sections(measurements)
            .loadFindings(loaded.getFindings())
            .build();
    }

    private SectionMeasurement measure(Section section, int limit) {
        return SectionMeasurement.builder()
            .heading(section.getDisplayHeading())
            .level(section.getLevel())
            .line(section.getLine())
            .length(section.getEffectiveLength())
            .limit(limit)
            .subsections(section.getChildren().size())
            .codeBlocks(section.countCodeBlocksInSpan())
            .build();
    }
}
