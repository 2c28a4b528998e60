package com.miniredis.components.services;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
public class LineSerializer {
    public static final String NIL = "(nil)";
    public static final String ERROR_PREFIX = "ERR ";

    public String serialize(Response response) {
        return switch (response.getKind()) {
            case SIMPLE -> response.getText() + "\n";
            case BULK -> (response.isNil() ? NIL : response.getText()) + "\n";
            case ERROR -> withErrorPrefix(response.getText()) + "\n";
        };
    }

    public byte[] toBytes(Response response) {
        return serialize(response).getBytes(StandardCharsets.UTF_8);
    }

    private String withErrorPrefix(String text) {
        return text.startsWith(ERROR_PREFIX) ? text : ERROR_PREFIX + text;
    }
}
