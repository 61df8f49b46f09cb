package com.logicloop.core.generator;

/**
 * Outcome of comparing a candidate with the current best.
 *
 *   IMPROVED: candidate replaces the current best; revert streak resets
 *   REVERT  : current best stays; revert streak grows by one
 */
public enum Decision {
    IMPROVED,
    REVERT
}
