// File: TamperPolicy.java
package org.security.watermark;

/** What a {@link ProtectedCall} does when the received parameters fail verification. */
public enum TamperPolicy {
    /** Throw {@link TamperedParametersException}. */
    RAISE,
    /** Skip the protected body and return the configured sentinel. */
    RETURN_SENTINEL,
    /** Run the protected body on the raw, still watermarked parameters. */
    CALL_ANYWAY
}
