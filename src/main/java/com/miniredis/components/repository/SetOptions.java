package com.miniredis.components.repository;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class SetOptions {
    private final SetMode mode;
    private final Long expire;
    private final boolean keepTtl;

    public static SetOptions defaults() {
        return new SetOptions(SetMode.DEFAULT, null, false);
    }

    public static SetOptions of(SetMode mode) {
        return new SetOptions(mode, null, false);
    }

    public Optional<Long> getExpire() {
        return Optional.ofNullable(expire);
    }
}
