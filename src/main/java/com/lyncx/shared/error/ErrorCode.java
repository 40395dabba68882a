package com.lyncx.shared.error;

import org.springframework.http.HttpStatus;

/**
 * 錯誤分類
 *
 * 每個錯誤對應固定的 HTTP status 與回傳給前端的訊息，
 * controller / handler 只依照這張表轉換，不自行決定狀態碼。
 */
public enum ErrorCode {

    MISSING_TOKEN(HttpStatus.UNAUTHORIZED, "Access token required"),
    /** 過期與簽名錯誤共用同一個訊息，不透露是哪一種 */
    INVALID_TOKEN(HttpStatus.FORBIDDEN, "Invalid or expired token"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    ALREADY_EXISTS(HttpStatus.CONFLICT, "User already exists"),
    INVALID_PLAN_TYPE(HttpStatus.BAD_REQUEST, "Invalid plan type"),
    MISSING_FIELDS(HttpStatus.BAD_REQUEST, "Missing required user data"),
    STORE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String message;

    ErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
