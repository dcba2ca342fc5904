package org.gamma.geobatch.processing;

/**
 * Verdict of the credential check run before a batch starts.
 *
 * @param constrainedTier true for a free-tier key, false for an unconstrained one, null when unknown
 * @param errorMessage    why the check failed, or null when it succeeded
 */
public record PreflightResult(Boolean constrainedTier, String errorMessage) {

    public static PreflightResult of(boolean constrainedTier) {
        return new PreflightResult(constrainedTier, null);
    }

    public static PreflightResult failed(String errorMessage) {
        return new PreflightResult(null, errorMessage);
    }

    public boolean isConstrained() {
        return Boolean.TRUE.equals(constrainedTier);
    }

    public boolean hasError() {
        return errorMessage != null;
    }
}
