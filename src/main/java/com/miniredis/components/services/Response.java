package com.miniredis.components.services;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class Response {
    public enum Kind {
        SIMPLE,
        BULK,
        ERROR
    }

    private final Kind kind;
    private final String text;

    public static Response simple(String text) {
        return new Response(Kind.SIMPLE, text);
    }

    public static Response bulk(String text) {
        return new Response(Kind.BULK, text);
    }

    public static Response nil() {
        return new Response(Kind.BULK, null);
    }

    public static Response error(String text) {
        return new Response(Kind.ERROR, text);
    }

    public boolean isNil() {
        return kind == Kind.BULK && text == null;
    }
}
