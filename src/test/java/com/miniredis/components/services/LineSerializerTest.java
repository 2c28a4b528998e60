package com.miniredis.components.services;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LineSerializerTest {
    private final LineSerializer lineSerializer = new LineSerializer();

    @Test
    public void testSimpleAndBulk() {
        assertEquals("OK\n", lineSerializer.serialize(Response.simple("OK")));
        assertEquals("hello world\n", lineSerializer.serialize(Response.bulk("hello world")));
    }

    @Test
    public void testNilIsDistinctFromValues() {
        assertEquals("(nil)\n", lineSerializer.serialize(Response.nil()));
        assertNotEquals(lineSerializer.serialize(Response.nil()), lineSerializer.serialize(Response.bulk("")));
    }

    @Test
    public void testValuesAreWrittenVerbatim() {
        assertEquals("(nil)\n", lineSerializer.serialize(Response.bulk("(nil)")));
        assertEquals("ERR not an error\n", lineSerializer.serialize(Response.bulk("ERR not an error")));
        assertEquals(Response.Kind.BULK, Response.bulk("(nil)").getKind());
        assertFalse(Response.bulk("(nil)").isNil());
    }

    @Test
    public void testErrorsCarryPrefix() {
        assertEquals("ERR empty command\n", lineSerializer.serialize(Response.error("empty command")));
        assertEquals("ERR syntax error\n", lineSerializer.serialize(Response.error("ERR syntax error")));
        assertEquals("ERR command too long\n",
                lineSerializer.serialize(new CommandException(ProtocolError.TOO_LONG).toResponse()));
    }

    @Test
    public void testToBytesIsUtf8() {
        assertArrayEquals("héllo\n".getBytes(StandardCharsets.UTF_8), lineSerializer.toBytes(Response.bulk("héllo")));
    }
}
