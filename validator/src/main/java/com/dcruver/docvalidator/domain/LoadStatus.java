package com.dcruver.docvalidator.domain;

public enum LoadStatus {
    OK,
    PARSE_ERROR,
    IO_ERROR
}
