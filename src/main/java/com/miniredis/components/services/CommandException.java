package com.miniredis.components.services;

import lombok.Getter;

@Getter
public class CommandException extends RuntimeException {
    private final ProtocolError error;

    public CommandException(ProtocolError error) {
        super(error.getMessage());
        this.error = error;
    }

    public CommandException(ProtocolError error, String detail) {
        super(detail);
        this.error = error;
    }

    public static CommandException unknownCommand(String name) {
        return new CommandException(ProtocolError.UNKNOWN_COMMAND, "unknown command '" + name + "'");
    }

    public static CommandException badArguments(String reason) {
        return new CommandException(ProtocolError.BAD_ARGUMENTS, reason);
    }

    public Response toResponse() {
        return Response.error(LineSerializer.ERROR_PREFIX + getMessage());
    }
}
