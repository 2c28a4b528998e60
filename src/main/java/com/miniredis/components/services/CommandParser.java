package com.miniredis.components.services;

import com.miniredis.components.repository.MonotonicClock;
import com.miniredis.components.repository.SetMode;
import com.miniredis.components.repository.SetOptions;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

@Component
public class CommandParser {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final MonotonicClock clock;

    public CommandParser(MonotonicClock clock) {
        this.clock = clock;
    }

    public Command parse(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            throw new CommandException(ProtocolError.EMPTY);
        }

        String[] tokens = WHITESPACE.split(trimmed);
        String name = tokens[0];
        List<String> args = Arrays.asList(tokens).subList(1, tokens.length);

        return switch (name) {
            case "PING" -> args.isEmpty() ? Command.ping() : Command.unknown(name);
            case "ECHO" -> args.isEmpty() ? Command.unknown(name) : Command.echo(String.join(" ", args));
            case "GET" -> args.size() == 1 ? Command.get(args.get(0)) : Command.unknown(name);
            case "SET" -> args.size() >= 2 ? parseSet(args) : Command.unknown(name);
            case "DEL" -> args.isEmpty() ? Command.unknown(name) : Command.del(args);
            case "EXISTS" -> args.isEmpty() ? Command.unknown(name) : Command.exists(args);
            case "EXPIREAT" -> args.size() == 2 ? parseExpireAt(args) : Command.unknown(name);
            case "PERSIST" -> args.size() == 1 ? Command.persist(args.get(0)) : Command.unknown(name);
            case "TTLMS" -> args.size() == 1 ? Command.ttlMs(args.get(0)) : Command.unknown(name);
            default -> Command.unknown(name);
        };
    }

    private Command parseExpireAt(List<String> args) {
        long seconds = parseDuration(args.get(1), "expireat");
        return Command.expireAt(args.get(0), deadline(TimeUnit.SECONDS, seconds, "expireat"));
    }

    // SET key value... [NX|XX] [KEEPTTL] [EX seconds|PX millis], modifiers read from the end
    private Command parseSet(List<String> args) {
        String key = args.get(0);
        List<String> rest = args.subList(1, args.size());

        boolean onlyIfAbsent = false;
        boolean onlyIfPresent = false;
        boolean keepTtl = false;
        Long expire = null;

        int end = rest.size();
        while (end > 1) {
            String last = rest.get(end - 1).toUpperCase();
            if (last.equals("NX")) {
                onlyIfAbsent = true;
                end--;
            } else if (last.equals("XX")) {
                onlyIfPresent = true;
                end--;
            } else if (last.equals("KEEPTTL")) {
                keepTtl = true;
                end--;
            } else if (end > 2 && isExpireOption(rest.get(end - 2)) && INTEGER.matcher(rest.get(end - 1)).matches()) {
                if (expire != null) {
                    throw CommandException.badArguments("syntax error");
                }
                TimeUnit unit = rest.get(end - 2).equalsIgnoreCase("EX") ? TimeUnit.SECONDS : TimeUnit.MILLISECONDS;
                long amount = parseDuration(rest.get(end - 1), "set");
                if (amount == 0) {
                    throw CommandException.badArguments("invalid expire time in 'set' command");
                }
                expire = deadline(unit, amount, "set");
                end -= 2;
            } else {
                break;
            }
        }

        if (onlyIfAbsent && onlyIfPresent) {
            throw CommandException.badArguments("syntax error");
        }

        SetMode mode = onlyIfAbsent ? SetMode.ONLY_IF_ABSENT
                : onlyIfPresent ? SetMode.ONLY_IF_PRESENT
                : SetMode.DEFAULT;
        String value = String.join(" ", rest.subList(0, end));
        return Command.set(key, value, new SetOptions(mode, expire, keepTtl));
    }

    private static boolean isExpireOption(String token) {
        return token.equalsIgnoreCase("EX") || token.equalsIgnoreCase("PX");
    }

    private static long parseDuration(String token, String commandName) {
        long amount;
        try {
            amount = Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw CommandException.badArguments("value is not an integer or out of range");
        }
        if (amount < 0) {
            throw CommandException.badArguments("invalid expire time in '" + commandName + "' command");
        }
        return amount;
    }

    private long deadline(TimeUnit unit, long amount, String commandName) {
        try {
            return Math.addExact(clock.nanoTime(), unit.toNanos(amount));
        } catch (ArithmeticException e) {
            throw CommandException.badArguments("invalid expire time in '" + commandName + "' command");
        }
    }
}
