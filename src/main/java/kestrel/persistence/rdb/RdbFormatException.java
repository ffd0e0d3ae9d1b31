package kestrel.persistence.rdb;

import java.io.IOException;

/** The file is not a readable dump: the header magic is wrong, or a string is truncated or impossibly long. */
public class RdbFormatException extends IOException {
    public RdbFormatException(String message) {
        super(message);
    }
}
