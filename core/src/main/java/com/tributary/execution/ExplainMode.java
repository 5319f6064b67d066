package com.tributary.execution;

import java.util.Locale;

/**
 * Output formats of {@link QueryExecution#explainString(ExplainMode)}.
 */
public enum ExplainMode {
    /** Physical plan only. */
    SIMPLE,
    /** Logical and physical plans. */
    EXTENDED,
    /** Generated code; operators here are interpreted, so this reports none. */
    CODEGEN,
    /** Logical plan with row count statistics, then the physical plan. */
    COST,
    /** Physical plan outline followed by per-operator details. */
    FORMATTED;

    public String lowerCaseName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
