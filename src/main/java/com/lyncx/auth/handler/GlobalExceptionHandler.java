package com.lyncx.auth.handler;

import com.lyncx.shared.dto.ErrorResponse;
import com.lyncx.shared.error.AccountException;
import com.lyncx.shared.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全域例外處理
 *
 * 把 {@link AccountException} 依 {@link ErrorCode} 轉成固定的 HTTP status，
 * 其餘例外統一為 JSON 格式的錯誤訊息。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AccountException.class)
    public ResponseEntity<ErrorResponse> handleAccount(AccountException e) {
        ErrorCode code = e.getErrorCode();
        if (code == ErrorCode.STORE_UNAVAILABLE) {
            log.error("文件資料庫存取失敗: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(code.getStatus())
                .body(ErrorResponse.builder().error(code.getMessage()).build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("參數驗證失敗");
        return ResponseEntity.badRequest()
                .body(ErrorResponse.builder()
                        .error(ErrorCode.MISSING_FIELDS.getMessage())
                        .message(message)
                        .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("無法解析 request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.builder().error("Invalid request body").build());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        log.warn("不支援的 Content-Type: {}", e.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ErrorResponse.builder().error("Invalid request body").build());
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.builder().error("Endpoint not found").build());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        if (e.getMessage() != null && e.getMessage().contains("用戶未登入")) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorResponse.builder().error(ErrorCode.MISSING_TOKEN.getMessage()).build());
        }
        log.error("Unhandled error", e);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return internalError();
    }

    private ResponseEntity<ErrorResponse> internalError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.builder().error("Internal server error").build());
    }
}
