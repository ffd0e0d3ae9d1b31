package kestrel.persistence.rdb;

import kestrel.utils.Log;
import kestrel.utils.Time;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the keys of a dump file without materializing values.
 * Only plain string records are understood; the scan ends at the first record of any other
 * type. LZF-compressed strings are rejected with {@link UnsupportedRdbEncodingException}.
 */
public class RdbReader implements Closeable {
    private final DataInputStream in;
    private boolean scanned;

    /**
     * Opens {@code file} and validates its header.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws RdbFormatException if the file does not start with the dump magic
     */
    public RdbReader(Path file) throws IOException {
        this(Files.newInputStream(file));
    }

    public RdbReader(InputStream inputStream) throws IOException {
        this.in = new DataInputStream(new BufferedInputStream(inputStream));
        try {
            validateHeader();
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    /** Opens, scans and closes {@code file}. */
    public static ScanResult scan(Path file) throws IOException {
        try (RdbReader reader = new RdbReader(file)) {
            return reader.readKeys();
        }
    }

    private void validateHeader() throws IOException {
        byte[] magic = new byte[RdbConstants.RDB_MAGIC.length()];
        try {
            in.readFully(magic);
        } catch (EOFException e) {
            throw new RdbFormatException("File too short for a dump header");
        }
        if (!Arrays.equals(magic, RdbConstants.RDB_MAGIC.getBytes(StandardCharsets.US_ASCII))) {
            throw new RdbFormatException("Invalid RDB magic");
        }

        byte[] version = new byte[RdbConstants.RDB_VERSION_LENGTH];
        try {
            in.readFully(version); // Any version is accepted
        } catch (EOFException e) {
            throw new RdbFormatException("File too short for a dump header");
        }
    }

    /**
     * Reads a length, or an integer when the control byte carries one of the integer encodings.
     */
    public long readLength() throws IOException {
        int first = in.readUnsignedByte();
        switch (first >> 6) {
            case RdbConstants.RDB_6BITLEN:
                return first & 0x3F;
            case RdbConstants.RDB_14BITLEN:
                return ((first & 0x3F) << 8) | in.readUnsignedByte();
            case RdbConstants.RDB_32BITLEN:
                return in.readInt() & 0xFFFFFFFFL;
            default:
                return readEncodedInt(first);
        }
    }

    /**
     * Reads a length-prefixed string. Integer-encoded strings come back as their decimal text.
     */
    public String readString() throws IOException {
        in.mark(1);
        int first = in.readUnsignedByte();
        if ((first >> 6) == RdbConstants.RDB_ENCVAL) {
            return Long.toString(readEncodedInt(first));
        }
        in.reset();

        long len = readLength();
        if (len > RdbConstants.RDB_MAX_STRING_LENGTH) {
            throw new RdbFormatException("String length out of range: " + len);
        }
        // Allocates only as much as the stream actually delivers
        byte[] bytes = in.readNBytes((int) len);
        if (bytes.length != len) {
            throw new RdbFormatException("Truncated string: expected " + len + " bytes, got " + bytes.length);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    // Integer payloads are unsigned; the 16- and 32-bit forms are little-endian.
    private long readEncodedInt(int control) throws IOException {
        switch (control) {
            case RdbConstants.RDB_ENC_INT8:
                return in.readUnsignedByte();
            case RdbConstants.RDB_ENC_INT16:
                return Short.toUnsignedInt(Short.reverseBytes(in.readShort()));
            case RdbConstants.RDB_ENC_INT32:
                return Integer.toUnsignedLong(Integer.reverseBytes(in.readInt()));
            default:
                throw new UnsupportedRdbEncodingException(control);
        }
    }

    private void skipString() throws IOException {
        in.mark(1);
        int first = in.readUnsignedByte();
        if ((first >> 6) == RdbConstants.RDB_ENCVAL) {
            readEncodedInt(first);
            return;
        }
        in.reset();
        skipFully(readLength());
    }

    private void skipFully(long n) throws IOException {
        while (n > 0) {
            int step = (int) Math.min(n, Integer.MAX_VALUE);
            int skipped = in.skipBytes(step);
            if (skipped <= 0) {
                throw new EOFException("Unexpected end of dump file");
            }
            n -= skipped;
        }
    }

    /**
     * Scans the records after the header and returns the string keys that are still live.
     * Can only be called once per reader.
     */
    public ScanResult readKeys() throws IOException {
        if (scanned) {
            throw new IllegalStateException("Dump file already scanned");
        }
        scanned = true;

        List<SnapshotRecord> records = new ArrayList<>();
        long now = Time.now();

        while (true) {
            int flag = in.read();
            if (flag == -1 || flag == RdbConstants.RDB_OPCODE_EOF) break;

            if (flag == RdbConstants.RDB_OPCODE_SELECTDB) {
                readLength();
                continue;
            }
            if (flag == RdbConstants.RDB_OPCODE_RESIZEDB) {
                readLength(); // db size
                readLength(); // expires size
                continue;
            }
            if (flag == RdbConstants.RDB_OPCODE_AUX) {
                readString();
                skipString();
                continue;
            }

            boolean hasExpiry = false;
            long expireAt = 0;
            if (flag == RdbConstants.RDB_OPCODE_EXPIRETIME) {
                hasExpiry = true;
                expireAt = Integer.toUnsignedLong(Integer.reverseBytes(in.readInt())) * 1000L;
                flag = in.readUnsignedByte();
            } else if (flag == RdbConstants.RDB_OPCODE_EXPIRETIME_MS) {
                hasExpiry = true;
                expireAt = Long.reverseBytes(in.readLong());
                flag = in.readUnsignedByte();
            }

            if (flag != RdbConstants.RDB_TYPE_STRING) {
                Log.debug("Stopping dump scan at unsupported record type " + flag);
                return new ScanResult(records, flag);
            }

            String key = readString();
            skipString();

            SnapshotRecord record = hasExpiry ? new SnapshotRecord(key, expireAt) : new SnapshotRecord(key);
            if (!record.isExpired(now)) {
                records.add(record);
            }
        }
        return new ScanResult(records, ScanResult.NONE);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
