package kestrel.commands.string;

import kestrel.protocol.Request;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SetCommandTest {

    private static long px(String... args) {
        return SetCommand.parsePx(new Request("SET", Arrays.asList(args)));
    }

    @Test
    public void testPxClause() {
        assertEquals(100, px("k", "v", "PX", "100"));
        assertEquals(100, px("k", "v", "px", "100"));
        assertEquals(0, px("k", "v", "Px", "0"));
    }

    @Test
    public void testNoUsablePxClause() {
        assertEquals(-1, px("k", "v"));
        assertEquals(-1, px("k", "v", "PX"));
        assertEquals(-1, px("k", "v", "EX", "100"));
        assertEquals(-1, px("k", "v", "PX", "-1"));
        assertEquals(-1, px("k", "v", "PX", "+5"));
        assertEquals(-1, px("k", "v", "PX", "12ab"));
        assertEquals(-1, px("k", "v", "PX", ""));
        assertEquals(-1, px("k", "v", "PX", "99999999999999999999999"));
    }

    @Test
    public void testPxCheckedPositionally() {
        assertEquals(-1, px("k", "v", "NX", "PX", "100"));
        assertEquals(100, px("k", "v", "PX", "100", "extra"));
    }
}
