package com.project.barcode.localization.service;

/**
 * How many regions a single qualifying run of non-zero columns produces.
 */
public enum EmissionPolicy {
    /** One region per column once the run reaches the minimum length, each one column wider. */
    GROWING,
    /** Only the region emitted when the run first reaches the minimum length. */
    FIRST,
    /** A single region spanning the whole run, emitted when the run ends. */
    MAXIMAL
}
