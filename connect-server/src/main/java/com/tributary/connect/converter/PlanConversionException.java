package com.tributary.connect.converter;

import com.tributary.exception.TributaryException;

/**
 * Thrown when a wire plan is malformed or uses a relation that cannot be converted.
 */
public class PlanConversionException extends TributaryException {

    public PlanConversionException(String message) {
        super(message);
    }

    public PlanConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
