package com.lyncx.store;

public class DocumentNotFoundException extends DocumentStoreException {

    public DocumentNotFoundException(String collection, String id) {
        super("文件不存在: " + collection + "/" + id);
    }

    public DocumentNotFoundException(String collection, String id, Throwable cause) {
        super("文件不存在: " + collection + "/" + id, cause);
    }
}
