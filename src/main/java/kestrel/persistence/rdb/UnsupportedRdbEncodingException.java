package kestrel.persistence.rdb;

import java.io.IOException;

/** A length or string uses an encoding this reader does not decode, such as LZF. */
public class UnsupportedRdbEncodingException extends IOException {
    private final int encoding;

    public UnsupportedRdbEncodingException(int encoding) {
        super(String.format("Unsupported string encoding: 0x%02X", encoding));
        this.encoding = encoding;
    }

    public int getEncoding() {
        return encoding;
    }
}
