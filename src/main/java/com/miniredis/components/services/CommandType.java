package com.miniredis.components.services;

public enum CommandType {
    PING,
    ECHO,
    GET,
    SET,
    DEL,
    EXISTS,
    EXPIREAT,
    PERSIST,
    TTLMS,
    UNKNOWN
}
