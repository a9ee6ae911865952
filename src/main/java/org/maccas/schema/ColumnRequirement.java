package org.maccas.schema;

/**
 * Whether a missing column aborts the run or degrades to zeros.
 */
public enum ColumnRequirement {
    REQUIRED,
    OPTIONAL
}
