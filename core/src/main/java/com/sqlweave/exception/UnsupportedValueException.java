package com.sqlweave.exception;

/**
 * Thrown by the value marshaller when a host value's runtime type matches
 * none of the recognized cases and exposes no textual representation.
 */
public class UnsupportedValueException extends SQLGenerationException {

    public UnsupportedValueException(String message, Class<?> failedType) {
        super(message, failedType);
    }

    /**
     * Creates the standard "unsupported type" error for a value.
     *
     * @param value the offending value (must not be null)
     * @return the exception
     */
    public static UnsupportedValueException forValue(Object value) {
        Class<?> type = value.getClass();
        return new UnsupportedValueException("unsupported type " + type.getName(), type);
    }
}
