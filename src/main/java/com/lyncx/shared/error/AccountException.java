package com.lyncx.shared.error;

import lombok.Getter;

/**
 * 業務錯誤
 *
 * 由 service / store 拋出，GlobalExceptionHandler 依 {@link ErrorCode} 轉成 HTTP 回應。
 */
@Getter
public class AccountException extends RuntimeException {

    private final ErrorCode errorCode;

    public AccountException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public AccountException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public AccountException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
