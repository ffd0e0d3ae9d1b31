package kestrel.commands;

import kestrel.Config;
import kestrel.KestrelServerContext;
import kestrel.db.KeyValueStore;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;
import kestrel.protocol.Resp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class CommandRegistryTest {

    private Config config;
    private KeyValueStore store;
    private CommandRegistry registry;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        config = Config.defaults();
        store = new KeyValueStore();
        registry = new CommandRegistry(new KestrelServerContext(store, config));
    }

    private String run(String... parts) {
        Request request = new Request(parts[0].toUpperCase(), Arrays.asList(parts).subList(1, parts.length));
        Reply reply = registry.dispatch(request);
        return new String(reply.toResp(), StandardCharsets.UTF_8);
    }

    private String error(String... parts) {
        CommandException e = assertThrows(CommandException.class, () -> run(parts));
        return e.getMessage();
    }

    @Test
    public void testPing() {
        assertEquals("+PONG\r\n", run("PING"));
        assertEquals("+PONG\r\n", run("PING", "ignored"));
    }

    @Test
    public void testEcho() {
        assertEquals("$5\r\nhello\r\n", run("ECHO", "hello"));
        assertEquals("$0\r\n\r\n", run("ECHO", ""));
        assertEquals("ERR wrong number of arguments for 'echo' command", error("ECHO"));
    }

    @Test
    public void testSetThenGet() {
        assertEquals("+OK\r\n", run("SET", "foo", "bar"));
        assertEquals("$3\r\nbar\r\n", run("GET", "foo"));
        assertEquals("$-1\r\n", run("GET", "nope"));
    }

    @Test
    public void testSetWithPx() {
        assertEquals("+OK\r\n", run("SET", "k", "v", "px", "0"));
        assertEquals("$-1\r\n", run("GET", "k"));

        assertEquals("+OK\r\n", run("SET", "k2", "v", "PX", "60000"));
        assertEquals("$1\r\nv\r\n", run("GET", "k2"));
    }

    @Test
    public void testSetWithMalformedPxStoresWithoutExpiry() {
        assertEquals("+OK\r\n", run("SET", "k", "v", "PX", "-5"));
        assertEquals("$1\r\nv\r\n", run("GET", "k"));
    }

    @Test
    public void testSetArityAndEmptyKey() {
        assertEquals("ERR wrong number of arguments for 'set' command", error("SET", "k"));
        assertTrue(error("SET", "", "v").startsWith("ERR "));
    }

    @Test
    public void testGetArity() {
        assertEquals("ERR wrong number of arguments for 'get' command", error("GET"));
    }

    @Test
    public void testConfigGet() {
        assertEquals("*2\r\n$3\r\ndir\r\n$2\r\n./\r\n", run("CONFIG", "GET", "dir"));
        assertEquals("*2\r\n$10\r\ndbfilename\r\n$8\r\ndump.rdb\r\n", run("CONFIG", "get", "dbfilename"));
    }

    @Test
    public void testConfigErrors() {
        assertEquals("ERR wrong number of arguments for 'config' command", error("CONFIG", "GET"));
        assertEquals("ERR unknown config parameter 'maxmemory'", error("CONFIG", "GET", "maxmemory"));
        assertEquals("ERR unknown subcommand 'SET' for 'config'", error("CONFIG", "SET", "dir"));
    }

    @Test
    public void testUnknownCommand() {
        UnknownCommandException e = assertThrows(UnknownCommandException.class,
                () -> registry.dispatch(new Request("FLUSHALL", Arrays.asList())));
        assertEquals("ERR unknown command 'FLUSHALL'", e.getMessage());
    }

    @Test
    public void testKeysReadsDumpFile() throws Exception {
        byte[] dump = new byte[] {
                'R', 'E', 'D', 'I', 'S', '0', '0', '1', '1',
                (byte) 0xFE, 0x00,
                0x00, 0x03, 'f', 'o', 'o', 0x03, 'b', 'a', 'r',
                0x00, 0x03, 'b', 'a', 'z', 0x00,
                (byte) 0xFF
        };
        Files.write(tempDir.resolve("dump.rdb"), dump);
        config.set(Config.DIR, tempDir.toString());

        assertEquals(new String(Resp.array(Arrays.asList("foo", "baz")), StandardCharsets.UTF_8), run("KEYS", "*"));
        assertEquals("*0\r\n", run("KEYS", "f*"));
    }

    @Test
    public void testKeysWithoutDumpFileIsEmpty() {
        config.set(Config.DIR, tempDir.toString());
        assertEquals("*0\r\n", run("KEYS", "*"));
    }

    @Test
    public void testKeysWithOversizedKeyLengthIsEmpty() throws Exception {
        byte[] dump = new byte[] {
                'R', 'E', 'D', 'I', 'S', '0', '0', '1', '1',
                0x00, (byte) 0x80, 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xF0, 'a'
        };
        Files.write(tempDir.resolve("dump.rdb"), dump);
        config.set(Config.DIR, tempDir.toString());

        assertEquals("*0\r\n", run("KEYS", "*"));
    }

    @Test
    public void testKeysIgnoresInMemoryWrites() {
        config.set(Config.DIR, tempDir.toString());
        run("SET", "mem", "1");
        assertEquals("*0\r\n", run("KEYS", "*"));
    }

    @Test
    public void testKeysArity() {
        assertEquals("ERR wrong number of arguments for 'keys' command", error("KEYS"));
    }
}
