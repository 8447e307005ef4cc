package com.enterprise.autosave.exception;

/**
 * Exception thrown when a recurrence expression cannot be parsed
 */
public class RecurrenceParseException extends AutoSaveException {
    
    /**
     * Category of the parse failure
     */
    public enum ErrorKind {
        MALFORMED_EXPRESSION,
        FIELD_OUT_OF_RANGE
    }
    
    private final ErrorKind kind;
    private final String expression;
    private final String field;
    
    public RecurrenceParseException(ErrorKind kind, String expression, String field, String message) {
        super(String.format("Invalid recurrence expression '%s'%s: %s",
            expression, field != null ? " (" + field + ")" : "", message));
        this.kind = kind;
        this.expression = expression;
        this.field = field;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    public String getExpression() {
        return expression;
    }
    
    /**
     * Name of the offending field, or null when the expression as a whole is malformed
     */
    public String getField() {
        return field;
    }
}
