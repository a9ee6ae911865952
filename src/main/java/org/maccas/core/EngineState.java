package org.maccas.core;

/**
 * Matching engine state machine: INIT, then MATCHING rounds, one FINAL pass, then CONVERGED.
 */
public enum EngineState {
    INIT,
    MATCHING,
    FINAL,
    CONVERGED
}
