package com.finforecast.core.diagnostics;

/**
 * Reason attached to a failed {@link Outcome}. Missing data is never a cause code; it travels as
 * a null metric value instead.
 */
public enum CauseCode {
    NONE,
    FISCAL_YEAR_OUT_OF_RANGE,
    DOCUMENT_NOT_MAPPING,
    UNKNOWN_SCENARIO,
    INVALID_PARAMETERS,
    EMPTY_HISTORY,
    EMPTY_FCF_SERIES,
    DISCOUNT_NOT_ABOVE_GROWTH,
    RUNTIME_ERROR
}
