package kestrel.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class RespTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testDecodePing() throws Exception {
        Request req = Resp.decode(bytes("*1\r\n$4\r\nping\r\n"));
        assertEquals("PING", req.getName());
        assertTrue(req.getArgs().isEmpty());
    }

    @Test
    public void testDecodeKeepsArgumentCaseAndOrder() throws Exception {
        Request req = Resp.decode(bytes("*3\r\n$3\r\nset\r\n$3\r\nFoo\r\n$3\r\nbAr\r\n"));
        assertEquals("SET", req.getName());
        assertEquals(Arrays.asList("Foo", "bAr"), req.getArgs());
    }

    @Test
    public void testDecodeEmptyBulkString() throws Exception {
        Request req = Resp.decode(bytes("*2\r\n$4\r\nECHO\r\n$0\r\n\r\n"));
        assertEquals(Collections.singletonList(""), req.getArgs());
    }

    @Test
    public void testDecodeBulkContainingCrlf() throws Exception {
        Request req = Resp.decode(bytes("*2\r\n$4\r\nECHO\r\n$4\r\na\r\nb\r\n"));
        assertEquals("a\r\nb", req.arg(0));
    }

    @Test
    public void testDecodeUsesByteLengthForMultibyteText() throws Exception {
        byte[] frame = Resp.command("ECHO", "héllo");
        Request req = Resp.decode(frame);
        assertEquals("héllo", req.arg(0));
    }

    @Test
    public void testInvalidArrayHeader() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> Resp.decode(bytes("PING\r\n")));
        assertEquals("invalid array header", e.getMessage());

        e = assertThrows(ProtocolException.class, () -> Resp.decode(bytes("*0\r\n")));
        assertEquals("invalid array header", e.getMessage());

        e = assertThrows(ProtocolException.class, () -> Resp.decode(bytes("*abc\r\n")));
        assertEquals("invalid array header", e.getMessage());
    }

    @Test
    public void testNullBulkRejected() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> Resp.decode(bytes("*2\r\n$3\r\nGET\r\n$-1\r\n")));
        assertEquals("null bulk string not permitted in request", e.getMessage());
    }

    @Test
    public void testElementMustBeBulkString() {
        assertThrows(ProtocolException.class, () -> Resp.decode(bytes("*2\r\n$3\r\nGET\r\n:1\r\n")));
    }

    @Test
    public void testTruncatedFrameIsAnError() {
        assertThrows(ProtocolException.class, () -> Resp.decode(bytes("*2\r\n$3\r\nGET\r\n$3\r\nfo")));
        assertThrows(ProtocolException.class, () -> Resp.decode(bytes("*1\r\n")));
        assertThrows(ProtocolException.class, () -> Resp.decode(new byte[0]));
    }

    @Test
    public void testMissingCrlfAfterPayload() {
        assertThrows(ProtocolException.class, () -> Resp.decode(bytes("*1\r\n$4\r\nPINGxx")));
    }

    @Test
    public void testTryDecodeWaitsForMoreBytes() throws Exception {
        ByteBuf buf = Unpooled.copiedBuffer("*2\r\n$3\r\nGET\r\n$3\r\nfo", StandardCharsets.UTF_8);
        try {
            assertNull(Resp.tryDecode(buf));
            assertEquals(0, buf.readerIndex(), "reader index must be restored");

            buf.writeBytes(bytes("o\r\n*1\r\n$4\r\nPING\r\n"));
            Request first = Resp.tryDecode(buf);
            assertEquals("GET", first.getName());
            assertEquals("foo", first.arg(0));

            Request second = Resp.tryDecode(buf);
            assertEquals("PING", second.getName());
            assertFalse(buf.isReadable());
        } finally {
            buf.release();
        }
    }

    @Test
    public void testEncodeSimpleStatus() {
        assertEquals("+PONG\r\n", new String(Resp.simpleString("PONG"), StandardCharsets.UTF_8));
    }

    @Test
    public void testEncodeBulk() {
        assertEquals("$3\r\nbar\r\n", new String(Resp.bulkString("bar"), StandardCharsets.UTF_8));
        assertEquals("$0\r\n\r\n", new String(Resp.bulkString(""), StandardCharsets.UTF_8));
    }

    @Test
    public void testEncodeNullBulk() {
        assertEquals("$-1\r\n", new String(Resp.nullBulkString(), StandardCharsets.UTF_8));
        assertEquals("$-1\r\n", new String(Resp.bulkString(null), StandardCharsets.UTF_8));
    }

    @Test
    public void testEncodeArray() {
        assertEquals("*2\r\n$3\r\ndir\r\n$2\r\n./\r\n",
                new String(Resp.array(Arrays.asList("dir", "./")), StandardCharsets.UTF_8));
        assertEquals("*0\r\n", new String(Resp.array(Collections.emptyList()), StandardCharsets.UTF_8));
    }

    @Test
    public void testEncodeError() {
        assertEquals("-ERR unknown command 'FOO'\r\n",
                new String(Resp.error("ERR unknown command 'FOO'"), StandardCharsets.UTF_8));
    }

    @Test
    public void testErrorAndStatusStayOnOneLine() {
        assertEquals("-ERR unknown config parameter 'x'  +OK  '\r\n",
                new String(Resp.error("ERR unknown config parameter 'x'\r\n+OK\r\n'"), StandardCharsets.UTF_8));
        assertEquals("+a b\r\n", new String(Resp.simpleString("a\nb"), StandardCharsets.UTF_8));
    }

    @Test
    public void testReplyVariantsEncode() {
        assertEquals("+OK\r\n", new String(Reply.status("OK").toResp(), StandardCharsets.UTF_8));
        assertEquals("$3\r\nbar\r\n", new String(Reply.bulk("bar").toResp(), StandardCharsets.UTF_8));
        assertEquals("$-1\r\n", new String(Reply.nullBulk().toResp(), StandardCharsets.UTF_8));
        assertEquals("*1\r\n$1\r\nk\r\n", new String(Reply.array(Arrays.asList("k")).toResp(), StandardCharsets.UTF_8));
        assertEquals("-ERR boom\r\n", new String(Reply.error("ERR boom").toResp(), StandardCharsets.UTF_8));
    }
}
