package kestrel.protocol;

import java.io.IOException;

/**
 * Raised when a request frame does not follow the array-of-bulk-strings layout.
 */
public class ProtocolException extends IOException {
    public ProtocolException(String message) {
        super(message);
    }
}
