package com.spreadsheet.formula.engine;

/**
 * IDLE -> COMPUTING -> IDLE. Requests that arrive while COMPUTING are rejected, not queued.
 */
public enum EngineState {
    IDLE,
    COMPUTING
}
