package com.dcruver.docvalidator.domain;

/**
 * Value contract of a metadata field.
 */
public enum FieldKind {
    STRING,
    ENUM,
    PERCENTAGE,
    DATE,
    STRING_LIST
}
