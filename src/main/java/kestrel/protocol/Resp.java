package kestrel.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Request/reply codec for the Redis serialization protocol.
 * Requests are always arrays of bulk strings; replies cover status, bulk, null bulk,
 * array and error frames.
 */
public class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';

    /** Longest header line accepted while waiting for its terminator. */
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.UTF_8);

    // --- SERIALIZATION ---
    public static byte[] simpleString(String s) {
        return ("+" + singleLine(s) + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    /** Line breaks in {@code s} are replaced with spaces. */
    public static byte[] error(String s) {
        return ("-" + singleLine(s) + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] nullBulkString() {
        return NULL_BULK.clone();
    }

    public static byte[] bulkString(String s) {
        if (s == null) return nullBulkString();
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        writeBulk(bos, s);
        return bos.toByteArray();
    }

    public static byte[] array(List<String> elements) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bos.writeBytes(("*" + elements.size() + "\r\n").getBytes(StandardCharsets.UTF_8));
        for (String element : elements) {
            writeBulk(bos, element);
        }
        return bos.toByteArray();
    }

    /** Encodes a request the way a client sends it; used by tests and tooling. */
    public static byte[] command(String... parts) {
        List<String> list = new ArrayList<>(parts.length);
        for (String part : parts) {
            list.add(part);
        }
        return array(list);
    }

    // Status and error frames end at the first CRLF
    private static String singleLine(String s) {
        return s.replace('\r', ' ').replace('\n', ' ');
    }

    private static void writeBulk(ByteArrayOutputStream bos, String s) {
        byte[] payload = s.getBytes(StandardCharsets.UTF_8);
        bos.writeBytes(("$" + payload.length + "\r\n").getBytes(StandardCharsets.UTF_8));
        bos.writeBytes(payload);
        bos.writeBytes(CRLF);
    }

    // --- PARSING ---

    /**
     * Decodes exactly one complete request frame. Bytes after the frame are ignored.
     */
    public static Request decode(byte[] frame) throws ProtocolException {
        ByteBuf in = Unpooled.wrappedBuffer(frame);
        try {
            return decode(in);
        } finally {
            in.release();
        }
    }

    /**
     * Decodes one complete request frame starting at the reader index and advances past it.
     * A truncated frame is an error here; use {@link #tryDecode(ByteBuf)} to wait for more bytes.
     */
    public static Request decode(ByteBuf in) throws ProtocolException {
        int start = in.readerIndex();
        Request request = tryDecode(in);
        if (request == null) {
            in.readerIndex(start);
            throw new ProtocolException("incomplete request frame");
        }
        return request;
    }

    /**
     * Attempts to decode one request frame. Returns {@code null} and leaves the reader index
     * untouched when the buffer does not yet hold a complete frame.
     */
    public static Request tryDecode(ByteBuf in) throws ProtocolException {
        int start = in.readerIndex();
        if (!in.isReadable()) {
            return null;
        }
        if (in.getByte(start) != ARRAY) {
            throw new ProtocolException("invalid array header");
        }

        String header = readLine(in);
        if (header == null) {
            in.readerIndex(start);
            return null;
        }
        int count = parseLength(header, "invalid array header");
        if (count < 1) {
            throw new ProtocolException("invalid array header");
        }

        List<String> parts = new ArrayList<>(Math.min(count, 64));
        for (int i = 0; i < count; i++) {
            if (in.isReadable() && in.getByte(in.readerIndex()) != BULK_STRING) {
                throw new ProtocolException("invalid bulk string header");
            }
            String bulkHeader = readLine(in);
            if (bulkHeader == null) {
                in.readerIndex(start);
                return null;
            }
            int len = parseLength(bulkHeader, "invalid bulk string header");
            if (len < 0) {
                throw new ProtocolException("null bulk string not permitted in request");
            }
            if (in.readableBytes() < (long) len + 2) {
                in.readerIndex(start);
                return null;
            }
            String payload = in.readCharSequence(len, StandardCharsets.UTF_8).toString();
            if (in.readByte() != '\r' || in.readByte() != '\n') {
                throw new ProtocolException("expected CRLF after bulk string");
            }
            parts.add(payload);
        }

        String name = parts.get(0).toUpperCase(Locale.ROOT);
        return new Request(name, new ArrayList<>(parts.subList(1, parts.size())));
    }

    // Returns the line without its CRLF, or null when no terminator is buffered yet.
    private static String readLine(ByteBuf in) throws ProtocolException {
        int from = in.readerIndex();
        int lf = in.indexOf(from, in.writerIndex(), (byte) '\n');
        if (lf == -1) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                throw new ProtocolException("header line too long");
            }
            return null;
        }
        if (lf == from || in.getByte(lf - 1) != '\r') {
            throw new ProtocolException("header line must end with CRLF");
        }
        String line = in.toString(from, lf - 1 - from, StandardCharsets.UTF_8);
        in.readerIndex(lf + 1);
        return line;
    }

    private static int parseLength(String line, String error) throws ProtocolException {
        try {
            return Integer.parseInt(line.substring(1));
        } catch (NumberFormatException e) {
            throw new ProtocolException(error);
        }
    }
}
