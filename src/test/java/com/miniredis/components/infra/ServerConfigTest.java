package com.miniredis.components.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    public void testDefaults() {
        ServerConfig config = new ServerConfig();

        assertEquals("127.0.0.1", config.getBind());
        assertEquals(6380, config.getPort());
        assertEquals(1024, config.getMaxConns());
        assertEquals(6380, config.toSocketAddress().getPort());
    }

    @Test
    public void testArguments() {
        ServerConfig config = new ServerConfig();
        config.applyArguments(new String[]{"--bind", "0.0.0.0", "--port", "7000", "--max-conns", "8"});

        assertEquals("0.0.0.0", config.getBind());
        assertEquals(7000, config.getPort());
        assertEquals(8, config.getMaxConns());
    }

    @Test
    public void testInvalidArgumentsKeepDefaults() {
        ServerConfig config = new ServerConfig();
        config.applyArguments(new String[]{"--port", "not-a-port", "--max-conns", "0", "--unrelated", "--bind"});

        assertEquals(ServerConfig.DEFAULT_PORT, config.getPort());
        assertEquals(ServerConfig.DEFAULT_MAX_CONNS, config.getMaxConns());
        assertEquals(ServerConfig.DEFAULT_BIND, config.getBind());
    }

    @Test
    public void testPortOutOfRange() {
        ServerConfig config = new ServerConfig();
        config.applyArguments(new String[]{"--port", "70000"});

        assertEquals(ServerConfig.DEFAULT_PORT, config.getPort());
    }
}
