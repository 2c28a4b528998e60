package com.miniredis.components.infra;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "miniredis")
public class ServerConfig {
    public static final String DEFAULT_BIND = "127.0.0.1";
    public static final int DEFAULT_PORT = 6380;
    public static final int DEFAULT_MAX_CONNS = 1024;

    private String bind = DEFAULT_BIND;
    private int port = DEFAULT_PORT;
    private int maxConns = DEFAULT_MAX_CONNS;
    private int maxLineLength = 64 * 1024;
    private int readBufferSize = 1024;

    public void applyArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--bind" -> {
                    if (i + 1 < args.length) {
                        bind = args[++i];
                    } else {
                        log.error("Missing value for --bind. Using {}.", bind);
                    }
                }
                case "--port" -> {
                    Integer value = intArgument(args, ++i, "--port");
                    if (value != null && value >= 0 && value <= 65535) {
                        port = value;
                    } else {
                        log.error("Invalid port number provided. Using port {}.", port);
                    }
                }
                case "--max-conns" -> {
                    Integer value = intArgument(args, ++i, "--max-conns");
                    if (value != null && value > 0) {
                        maxConns = value;
                    } else {
                        log.error("Invalid connection limit provided. Using {}.", maxConns);
                    }
                }
                default -> {
                }
            }
        }
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(bind, port);
    }

    private static Integer intArgument(String[] args, int index, String flag) {
        if (index >= args.length) {
            log.error("Missing value for {}", flag);
            return null;
        }
        try {
            return Integer.parseInt(args[index]);
        } catch (NumberFormatException e) {
            log.error("Value for {} is not a number: {}", flag, args[index]);
            return null;
        }
    }
}
