package com.dcruver.docvalidator.io;

import com.dcruver.docvalidator.domain.Document;
import com.dcruver.docvalidator.domain.Finding;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Loader output: the document plus any read or metadata-block findings.
 */
@Data
@Builder
public class LoadedDocument {
    private final Document document;
    private final List<Finding> findings;
}
