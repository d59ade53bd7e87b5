// File: MalformedGraphException.java
package org.security.watermark;

/**
 * Raised by {@link WatermarkGraph#decode(int, int)} when the pointer structure is not a valid
 * watermark: a missing {@code next} relation or a digit target outside the ring.
 */
public class MalformedGraphException extends IllegalStateException {

    public MalformedGraphException(String message) {
        super(message);
    }
}
