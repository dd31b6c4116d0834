package com.ccdsim.model;

public enum Fault {
    UNIT_MISMATCH,
    FLAG_PRECONDITION,
    SHAPE_MISMATCH,
    UNKNOWN_KEY,
    INVALID_VALUE,
    RESOURCE
}
