package com.lyncx.store;

/**
 * 文件資料庫存取失敗（連線、權限、逾時等）
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
