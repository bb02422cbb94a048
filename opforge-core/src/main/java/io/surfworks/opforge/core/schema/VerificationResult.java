package io.surfworks.opforge.core.schema;

/**
 * Outcome of checking an operator instance against its schema.
 *
 * @param valid  whether every rule passed
 * @param reason why the first failing rule failed; empty when valid
 */
public record VerificationResult(boolean valid, String reason) {

    private static final VerificationResult OK = new VerificationResult(true, "");

    public static VerificationResult ok() {
        return OK;
    }

    public static VerificationResult failed(String reason) {
        return new VerificationResult(false, reason);
    }
}
