package com.lyncx.subscription.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 方案狀態
 *
 * 目前所有轉換都會把狀態重設為 ACTIVE。
 */
public enum PlanStatus {

    ACTIVE("active");

    private final String value;

    PlanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
