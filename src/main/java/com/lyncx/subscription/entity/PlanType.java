package com.lyncx.subscription.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 方案類型，對外以小寫字串表示（free / trial / pro / plus）
 */
public enum PlanType {

    FREE("free"),
    TRIAL("trial"),
    PRO("pro"),
    PLUS("plus");

    private final String value;

    PlanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 依字串值查找，大小寫需完全相符
     *
     * @return 不認得的值回傳 empty
     */
    public static Optional<PlanType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
