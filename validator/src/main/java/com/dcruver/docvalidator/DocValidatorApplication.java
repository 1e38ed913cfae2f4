package com.dcruver.docvalidator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the documentation validator.
 *
 * Checks a corpus of Markdown documents against the metadata schema and the
 * structural rules that keep them retrievable once split into chunks.
 * Read-only: documents are never modified.
 *
 * With arguments (e.g. {@code validate --docs-dir docs}) it runs one command and exits with
 * the validation status; without arguments it starts an interactive shell.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class DocValidatorApplication {

    public static void main(String[] args) {
        log.debug("Starting documentation validator...");
        System.exit(SpringApplication.exit(SpringApplication.run(DocValidatorApplication.class, args)));
    }
}
