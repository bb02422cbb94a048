package io.surfworks.opforge.core.schema;

/**
 * Thrown when cost inference is requested from a schema that has no cost
 * inference function registered.
 *
 * <p>Callers planning over a whole graph typically catch this and substitute
 * an estimate of their own:
 * <pre>{@code
 * Cost cost;
 * try {
 *     cost = schema.inferCost(def, shapes);
 * } catch (CostInferenceUnavailableException e) {
 *     cost = Cost.ZERO;
 * }
 * }</pre>
 */
public class CostInferenceUnavailableException extends RuntimeException {

    private final String operatorType;

    /**
     * @param operatorType the schema's operator type name
     */
    public CostInferenceUnavailableException(String operatorType) {
        super("No cost inference function registered for operator '" + operatorType + "'");
        this.operatorType = operatorType;
    }

    /**
     * Returns the operator type that lacks a cost function.
     */
    public String operatorType() {
        return operatorType;
    }
}
