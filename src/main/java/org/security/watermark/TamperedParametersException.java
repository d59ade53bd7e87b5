// File: TamperedParametersException.java
package org.security.watermark;

/**
 * The received parameter list did not carry the expected secret code. Thrown by
 * {@link ProtectedCall} under {@link TamperPolicy#RAISE}.
 */
public class TamperedParametersException extends RuntimeException {

    private final transient Controller.VerificationResult result;

    public TamperedParametersException(String message, Controller.VerificationResult result) {
        super(message);
        this.result = result;
    }

    public Controller.VerificationResult getResult() { return result; }
}
