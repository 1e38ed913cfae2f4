package com.dcruver.docvalidator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every rule the validator can report, with its default severity.
 * Declaration order is the order findings of one line are reported in.
 */
public enum RuleId {
    FILE_READ_ERROR("file-read-error", Severity.BLOCKING),
    MISSING_METADATA_BLOCK("missing-metadata-block", Severity.BLOCKING),
    METADATA_PARSE_ERROR("metadata-parse-error", Severity.BLOCKING),
    METADATA_MISSING_FIELD("metadata-missing-field", Severity.BLOCKING),
    METADATA_INVALID_ENUM("metadata-invalid-enum", Severity.BLOCKING),
    METADATA_INVALID_FORMAT("metadata-invalid-format", Severity.BLOCKING),
    NO_SECTIONS("no-sections", Severity.ADVISORY),
    SECTION_LENGTH("section-length", Severity.BLOCKING),
    HEADING_SKIP("heading-skip", Severity.ADVISORY),
    EMPTY_HEADING("empty-heading", Severity.ADVISORY),
    PRONOUN_OPENING("pronoun-opening", Severity.ADVISORY),
    CODE_BLOCK_NEEDS_SUBSECTION("code-block-needs-subsection", Severity.ADVISORY),
    CODE_BLOCK_NEEDS_PROSE("code-block-needs-prose", Severity.ADVISORY),
    UNCLOSED_CODE_FENCE("unclosed-code-fence", Severity.ADVISORY),
    FILENAME_CONVENTION("filename-convention", Severity.ADVISORY),
    DUPLICATE_BASENAME("duplicate-basename", Severity.BLOCKING),
    STUB_FILE("stub-file", Severity.ADVISORY),
    OVERSIZED_FILE("oversized-file", Severity.ADVISORY),
    MISSING_TRAILING_NEWLINE("missing-trailing-newline", Severity.ADVISORY);

    private final String id;
    private final Severity defaultSeverity;

    RuleId(String id, Severity defaultSeverity) {
        this.id = id;
        this.defaultSeverity = defaultSeverity;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    @Override
    public String toString() {
        return id;
    }
}
