package com.tributary.exception;

/**
 * Where a failure was raised.
 *
 * <p>Set once, at the point the failure is first turned into a
 * {@link TributaryException}, so that later layers can tell an engine-side
 * failure from one raised inside the embedded DuckDB runtime without
 * inspecting class names or stack frames.
 */
public enum ErrorOrigin {
    /** Raised by the plan conversion, planning or scheduling code. */
    ENGINE,
    /** Raised by the embedded DuckDB runtime while running SQL. */
    EMBEDDED_RUNTIME
}
