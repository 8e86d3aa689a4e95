package com.spicenet.core.error;

/**
 * Thrown when a value assigned to an element parameter cannot be coerced to the
 * parameter's declared kind, or when the parameter does not exist on the element.
 */
public class ParameterValidationException extends NetlistException {

    private final String parameterName;
    private final transient Object rejectedValue;

    public ParameterValidationException(String parameterName, Object rejectedValue, String reason) {
        super("Invalid value '" + rejectedValue + "' for parameter '" + parameterName + "': " + reason);
        this.parameterName = parameterName;
        this.rejectedValue = rejectedValue;
    }

    public ParameterValidationException(String parameterName, Object rejectedValue, String reason, Throwable cause) {
        super("Invalid value '" + rejectedValue + "' for parameter '" + parameterName + "': " + reason, cause);
        this.parameterName = parameterName;
        this.rejectedValue = rejectedValue;
    }

    public String getParameterName() {
        return parameterName;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
