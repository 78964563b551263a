package com.agilab.log_collecting.model;

public enum SortKey {
    NAME,
    SIZE,
    DATE
}
