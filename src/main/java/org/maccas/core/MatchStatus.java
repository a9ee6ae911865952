package org.maccas.core;

/**
 * Lifecycle of a confirmed match.
 */
public enum MatchStatus {
    ACCEPTED,
    REJECTED
}
