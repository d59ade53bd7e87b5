// File: CoverageException.java
package org.security.watermark;

/**
 * The parameter list has too few pairs for the configured eta: either fewer pairs than bit
 * positions, or some bit position receives no vote from the keyed index mapping.
 *
 * <p>Deterministic for a given (key, pair count, eta); only a configuration change helps.</p>
 */
public class CoverageException extends IllegalArgumentException {

    private final int covered;
    private final int required;

    public CoverageException(String message, int covered, int required) {
        super(message);
        this.covered = covered;
        this.required = required;
    }

    /** Bit positions (or pairs, when the pair count alone is short) actually available. */
    public int getCovered() { return covered; }

    /** The configured eta. */
    public int getRequired() { return required; }
}
