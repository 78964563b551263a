package com.agilab.log_collecting.model;

public enum FilterKind {
    ALL,
    REGEX,
    DATE
}
