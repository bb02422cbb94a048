package io.surfworks.opforge.core.schema;

/**
 * Thrown by registry helpers that require a schema for an operator type
 * that was never registered.
 */
public class SchemaNotFoundException extends RuntimeException {

    private final String operatorType;

    public SchemaNotFoundException(String operatorType, String action) {
        super(action + " failed. No schema for: " + operatorType);
        this.operatorType = operatorType;
    }

    public String operatorType() {
        return operatorType;
    }
}
