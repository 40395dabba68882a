package com.lyncx.store;

public class DocumentAlreadyExistsException extends DocumentStoreException {

    public DocumentAlreadyExistsException(String collection, String id) {
        super("文件已存在: " + collection + "/" + id);
    }

    public DocumentAlreadyExistsException(String collection, String id, Throwable cause) {
        super("文件已存在: " + collection + "/" + id, cause);
    }
}
