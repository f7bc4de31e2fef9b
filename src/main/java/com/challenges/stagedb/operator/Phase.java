package com.challenges.stagedb.operator;

/**
 * How far a row set has travelled through the operator chain. An operator only takes a
 * row set whose phase comes before its own, so nothing is processed twice.
 */
public enum Phase {
    SCANNED,
    FILTERED,
    SORTED,
    PROJECTED,
    DISTINCT,
    LIMITED
}
