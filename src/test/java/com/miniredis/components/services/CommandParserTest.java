package com.miniredis.components.services;

import com.miniredis.components.repository.ManualClock;
import com.miniredis.components.repository.SetMode;
import com.miniredis.components.repository.SetOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CommandParserTest {
    private final ManualClock clock = new ManualClock();
    private final CommandParser parser = new CommandParser(clock);

    @Test
    public void testSimpleCommands() {
        assertEquals(Command.ping(), parser.parse("PING"));
        assertEquals(Command.get("a"), parser.parse("  GET   a \r"));
        assertEquals(Command.del(List.of("a", "b", "a")), parser.parse("DEL a b a"));
        assertEquals(Command.exists(List.of("x")), parser.parse("EXISTS x"));
        assertEquals(Command.persist("k"), parser.parse("PERSIST k"));
        assertEquals(Command.ttlMs("k"), parser.parse("TTLMS k"));
    }

    @Test
    public void testEchoRejoinsArguments() {
        assertEquals(Command.echo("hello big world"), parser.parse("ECHO hello   big\tworld"));
    }

    @Test
    public void testKeywordsAreCaseSensitive() {
        Command command = parser.parse("ping");
        assertEquals(CommandType.UNKNOWN, command.getType());
        assertEquals("ping", command.getText());
    }

    @Test
    public void testArityMismatchIsUnknown() {
        assertEquals(CommandType.UNKNOWN, parser.parse("PING extra").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("ECHO").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("GET").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("GET a b").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("SET a").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("DEL").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("EXISTS").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("EXPIREAT a").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("PERSIST").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("TTLMS a b").getType());
        assertEquals(CommandType.UNKNOWN, parser.parse("FLUSHALL").getType());
    }

    @Test
    public void testEmptyLine() {
        CommandException e = assertThrows(CommandException.class, () -> parser.parse("   "));
        assertEquals(ProtocolError.EMPTY, e.getError());
    }

    @Test
    public void testSetDefault() {
        Command command = parser.parse("SET greeting hello there");

        assertEquals(CommandType.SET, command.getType());
        assertEquals("greeting", command.getKey());
        assertEquals("hello there", command.getText());
        assertEquals(SetOptions.defaults(), command.getOptions());
    }

    @Test
    public void testSetModifiers() {
        assertEquals(SetMode.ONLY_IF_ABSENT, parser.parse("SET k v NX").getOptions().getMode());
        assertEquals(SetMode.ONLY_IF_PRESENT, parser.parse("SET k v xx").getOptions().getMode());

        Command keep = parser.parse("SET k some value XX KEEPTTL");
        assertEquals("some value", keep.getText());
        assertTrue(keep.getOptions().isKeepTtl());
        assertEquals(SetMode.ONLY_IF_PRESENT, keep.getOptions().getMode());
    }

    @Test
    public void testSetExpiration() {
        Command ex = parser.parse("SET k v EX 10");
        assertEquals("v", ex.getText());
        assertEquals(clock.plus(10, TimeUnit.SECONDS), ex.getOptions().getExpire().orElseThrow());

        Command px = parser.parse("SET k v NX PX 250");
        assertEquals(SetMode.ONLY_IF_ABSENT, px.getOptions().getMode());
        assertEquals(clock.plus(250, TimeUnit.MILLISECONDS), px.getOptions().getExpire().orElseThrow());
    }

    @Test
    public void testModifierAloneIsTheValue() {
        Command command = parser.parse("SET k NX");
        assertEquals("NX", command.getText());
        assertEquals(SetMode.DEFAULT, command.getOptions().getMode());

        Command exValue = parser.parse("SET k EX 10");
        assertEquals("EX 10", exValue.getText());
        assertTrue(exValue.getOptions().getExpire().isEmpty());
    }

    @Test
    public void testSetRejectsConflictingModifiers() {
        CommandException both = assertThrows(CommandException.class, () -> parser.parse("SET k v NX XX"));
        assertEquals(ProtocolError.BAD_ARGUMENTS, both.getError());

        assertThrows(CommandException.class, () -> parser.parse("SET k v EX 1 PX 100"));
        assertThrows(CommandException.class, () -> parser.parse("SET k v EX -1"));
        assertThrows(CommandException.class, () -> parser.parse("SET k v PX 0"));
    }

    @Test
    public void testExpireAtIsSecondsFromNow() {
        Command command = parser.parse("EXPIREAT k 30");

        assertEquals(CommandType.EXPIREAT, command.getType());
        assertEquals("k", command.getKey());
        assertEquals(clock.plus(30, TimeUnit.SECONDS), command.getWhen());
        assertEquals(clock.nanoTime(), parser.parse("EXPIREAT k 0").getWhen());
    }

    @Test
    public void testExpireAtRejectsBadSeconds() {
        CommandException notNumber = assertThrows(CommandException.class, () -> parser.parse("EXPIREAT k soon"));
        assertEquals(ProtocolError.BAD_ARGUMENTS, notNumber.getError());

        CommandException negative = assertThrows(CommandException.class, () -> parser.parse("EXPIREAT k -5"));
        assertEquals("invalid expire time in 'expireat' command", negative.getMessage());

        assertThrows(CommandException.class, () -> parser.parse("EXPIREAT k " + Long.MAX_VALUE));
    }
}
