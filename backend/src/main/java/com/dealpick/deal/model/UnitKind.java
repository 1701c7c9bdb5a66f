package com.dealpick.deal.model;

public enum UnitKind {
    LB,
    OZ,
    FLOZ,
    EACH,
    COUNT,
    UNKNOWN
}
