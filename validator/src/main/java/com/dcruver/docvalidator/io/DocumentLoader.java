package com.dcruver.docvalidator.io;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import com.dcruver.docvalidator.domain.LoadStatus;
import com.dcruver.docvalidator.domain.Metadata;
import com.dcruver.docvalidator.domain.RuleId;
import com.dcruver.docvalidator.domain.SectionModelBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads a document and splits it into a YAML metadata block and a body.
 * Never throws for a bad file: read and parse problems come back as findings
 * and the body is still handed to the section model builder.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentLoader {

    private static final String DELIMITER = "---";
    private static final String YAML_END = "...";

    private final SectionModelBuilder sectionModelBuilder;
    private final YAMLMapper yamlMapper = new YAMLMapper();

    /**
     * Read and parse a document
     *
     * @param file         file on disk
     * @param relativePath path reported in findings
     */
    public LoadedDocument load(Path file, String relativePath) {
        String text;
        try {
            text = readUtf8(file);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", relativePath, e.getMessage());
            return unreadable(file, relativePath, e);
        }
        return parse(file, relativePath, text);
    }

    /**
     * Parse already-read text
     */
    public LoadedDocument parse(Path file, String relativePath, String text) {
        List<Finding> findings = new ArrayList<>();
        String[] lines = text.split("\n", -1);

        Metadata metadata = Metadata.empty();
        LoadStatus status = LoadStatus.OK;
        String body;
        int bodyStartLine;

        if (!DELIMITER.equals(strip(lines[0]))) {
            String hint = strip(lines[0]).startsWith("# ")
                ? " (found a heading before the metadata block)"
                : "";
            findings.add(Finding.of(RuleId.MISSING_METADATA_BLOCK, relativePath)
                .location("line 1")
                .line(1)
                .message("File must start with \"---\" metadata delimiter" + hint)
                .build());
            status = LoadStatus.PARSE_ERROR;
            body = text;
            bodyStartLine = 1;

        } else {
            int closing = findClosingDelimiter(lines);

            if (closing < 0) {
                findings.add(parseError(relativePath, "Metadata block is not closed (missing second \"---\")"));
                status = LoadStatus.PARSE_ERROR;
                body = text.substring(Math.min(text.length(), lines[0].length() + 1));
                bodyStartLine = 2;
            } else {
                String yaml = String.join("\n", List.of(lines).subList(1, closing));
                int bodyOffset = 0;
                for (int i = 0; i <= closing; i++) {
                    bodyOffset += lines[i].length() + 1;
                }
                body = text.substring(Math.min(text.length(), bodyOffset));
                bodyStartLine = closing + 2;

                try {
                    metadata = parseMetadata(yaml);
                } catch (MetadataFormatException e) {
                    findings.add(parseError(relativePath, e.getMessage()));
                    status = LoadStatus.PARSE_ERROR;
                }
            }
        }

        Document document = Document.builder()
            .path(file)
            .relativePath(relativePath)
            .rawText(text)
            .metadata(metadata)
            .body(body)
            .bodyStartLine(bodyStartLine)
            .sections(sectionModelBuilder.build(body, bodyStartLine))
            .status(status)
            .lineCount((int) text.lines().count())
            .build();

        log.debug("Loaded {} ({} lines, status {})", relativePath, document.getLineCount(), status);

        return LoadedDocument.builder()
            .document(document)
            .findings(findings)
            .build();
    }

    /**
     * Document for a file that could not be read or decoded
     */
    public LoadedDocument unreadable(Path file, String relativePath, Exception cause) {
        Document document = Document.builder()
            .path(file)
            .relativePath(relativePath)
            .metadata(Metadata.empty())
            .status(LoadStatus.IO_ERROR)
            .build();

        Finding finding = Finding.of(RuleId.FILE_READ_ERROR, relativePath)
            .message("Failed to read file: " + describe(cause))
            .build();

        return LoadedDocument.builder()
            .document(document)
            .findings(List.of(finding))
            .build();
    }

    private Metadata parseMetadata(String yaml) throws MetadataFormatException {
        JsonNode node;
        try {
            node = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new MetadataFormatException("Metadata YAML parse error: " + e.getOriginalMessage());
        }

        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new MetadataFormatException("Metadata block is empty");
        }
        if (!node.isObject()) {
            throw new MetadataFormatException("Metadata block did not parse to a key-value mapping");
        }

        LinkedHashMap<String, Object> fields = yamlMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
        return Metadata.of(fields);
    }

    private int findClosingDelimiter(String[] lines) {
        for (int i = 1; i < lines.length; i++) {
            String line = strip(lines[i]);
            if (DELIMITER.equals(line) || YAML_END.equals(line)) {
                return i;
            }
        }
        return -1;
    }

    private Finding parseError(String relativePath, String message) {
        return Finding.of(RuleId.METADATA_PARSE_ERROR, relativePath)
            .location("metadata")
            .line(1)
            .message(message)
            .build();
    }

    private static String readUtf8(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }

    private static String strip(String line) {
        return line.stripTrailing();
    }

    private static String describe(Exception e) {
        if (e instanceof CharacterCodingException) {
            return "not valid UTF-8";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Metadata block present but not a usable key-value mapping
     */
    private static class MetadataFormatException extends Exception {
        MetadataFormatException(String message) {
            super(message);
        }
    }
}
