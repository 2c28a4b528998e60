package com.miniredis.components.services;

import com.miniredis.components.repository.SetOptions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Command {
    private final CommandType type;
    private final String key;
    private final List<String> keys;
    private final String text;
    private final SetOptions options;
    private final Long when;

    public static Command ping() {
        return new Command(CommandType.PING, null, List.of(), null, null, null);
    }

    public static Command echo(String text) {
        return new Command(CommandType.ECHO, null, List.of(), text, null, null);
    }

    public static Command get(String key) {
        return new Command(CommandType.GET, key, List.of(), null, null, null);
    }

    public static Command set(String key, String value, SetOptions options) {
        return new Command(CommandType.SET, key, List.of(), value, options, null);
    }

    public static Command del(List<String> keys) {
        return new Command(CommandType.DEL, null, List.copyOf(keys), null, null, null);
    }

    public static Command exists(List<String> keys) {
        return new Command(CommandType.EXISTS, null, List.copyOf(keys), null, null, null);
    }

    public static Command expireAt(String key, long when) {
        return new Command(CommandType.EXPIREAT, key, List.of(), null, null, when);
    }

    public static Command persist(String key) {
        return new Command(CommandType.PERSIST, key, List.of(), null, null, null);
    }

    public static Command ttlMs(String key) {
        return new Command(CommandType.TTLMS, key, List.of(), null, null, null);
    }

    public static Command unknown(String name) {
        return new Command(CommandType.UNKNOWN, null, List.of(), name, null, null);
    }
}
