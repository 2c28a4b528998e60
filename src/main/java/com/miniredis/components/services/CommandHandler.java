package com.miniredis.components.services;

import com.miniredis.components.repository.KeyValueStore;
import com.miniredis.components.repository.SetOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Slf4j
@Component
public class CommandHandler {
    private final KeyValueStore store;

    public CommandHandler(KeyValueStore store) {
        this.store = store;
    }

    public Response handle(Command command) {
        return switch (command.getType()) {
            case PING -> ping();
            case ECHO -> echo(command);
            case GET -> get(command);
            case SET -> set(command);
            case DEL -> Response.simple(Integer.toString(store.del(command.getKeys())));
            case EXISTS -> Response.simple(Integer.toString(store.exists(command.getKeys())));
            case EXPIREAT -> Response.simple(Boolean.toString(store.expireAt(command.getKey(), command.getWhen())));
            case PERSIST -> Response.simple(Boolean.toString(store.persist(command.getKey())));
            case TTLMS -> ttlMs(command);
            case UNKNOWN -> CommandException.unknownCommand(command.getText()).toResponse();
        };
    }

    public Response ping() {
        return Response.simple("PONG");
    }

    public Response echo(Command command) {
        return Response.bulk(command.getText());
    }

    public Response get(Command command) {
        return store.get(command.getKey())
                .map(value -> Response.bulk(new String(value, StandardCharsets.UTF_8)))
                .orElseGet(Response::nil);
    }

    public Response set(Command command) {
        byte[] value = command.getText().getBytes(StandardCharsets.UTF_8);
        SetOutcome outcome = store.setWithOutcome(command.getKey(), value, command.getOptions());
        log.debug("SET {} ({}) -> {}", command.getKey(), command.getOptions().getMode(), outcome);

        return switch (outcome) {
            case CREATED -> Response.simple("OK");
            case UPDATED -> Response.simple("Updated");
            case REJECTED -> Response.nil();
        };
    }

    public Response ttlMs(Command command) {
        return store.ttlMs(command.getKey())
                .map(ttl -> Response.simple(Long.toString(ttl)))
                .orElseGet(Response::nil);
    }
}
