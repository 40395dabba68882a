package com.lyncx.store.firestore;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.lyncx.store.DocumentAlreadyExistsException;
import com.lyncx.store.DocumentNotFoundException;
import com.lyncx.store.DocumentStore;
import com.lyncx.store.DocumentStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Firestore 文件資料庫
 *
 * - get    → DocumentReference.get()
 * - create → DocumentReference.create()：伺服器端條件式寫入，已存在時回 ALREADY_EXISTS
 * - update → DocumentReference.update()：只合併提供的欄位，不存在時回 NOT_FOUND
 *
 * 同步等待 ApiFuture，呼叫端看到的是一次呼叫、一個結果。失敗不重試。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lyncx.store", name = "type", havingValue = "firestore", matchIfMissing = true)
public class FirestoreDocumentStore implements DocumentStore {

    private final Firestore firestore;

    @Override
    public Optional<Map<String, Object>> get(String collection, String id) {
        DocumentSnapshot snapshot = await(document(collection, id).get(), "get", collection, id);
        if (!snapshot.exists() || snapshot.getData() == null) {
            return Optional.empty();
        }
        return Optional.of(normalize(snapshot.getData()));
    }

    @Override
    public void create(String collection, String id, Map<String, Object> document) {
        await(document(collection, id).create(document), "create", collection, id);
        log.debug("Firestore 文件已建立: {}/{}", collection, id);
    }

    @Override
    public void update(String collection, String id, Map<String, Object> fields) {
        await(document(collection, id).update(fields), "update", collection, id);
    }

    private DocumentReference document(String collection, String id) {
        return firestore.collection(collection).document(id);
    }

    private <T> T await(ApiFuture<T> future, String operation, String collection, String id) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException(
                    "Firestore " + operation + " 被中斷: " + collection + "/" + id, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (hasStatus(cause, StatusCode.Code.ALREADY_EXISTS)) {
                throw new DocumentAlreadyExistsException(collection, id, cause);
            }
            if (hasStatus(cause, StatusCode.Code.NOT_FOUND)) {
                throw new DocumentNotFoundException(collection, id, cause);
            }
            log.error("Firestore {} 失敗: {}/{} {}", operation, collection, id, cause.getMessage());
            throw new DocumentStoreException(
                    "Firestore " + operation + " 失敗: " + collection + "/" + id, cause);
        }
    }

    /**
     * 沿 cause chain 找 gax ApiException 的 status code
     */
    static boolean hasStatus(Throwable error, StatusCode.Code code) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ApiException apiException
                    && apiException.getStatusCode() != null
                    && apiException.getStatusCode().getCode() == code) {
                return true;
            }
        }
        return false;
    }

    /**
     * Firestore 原生 Timestamp 轉成 ISO-8601 字串，其餘型別原樣保留
     */
    private static Map<String, Object> normalize(Map<String, Object> data) {
        Map<String, Object> result = new LinkedHashMap<>();
        data.forEach((key, value) -> result.put(key, normalizeValue(value)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object normalizeValue(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toDate().toInstant().toString();
        }
        if (value instanceof Map<?, ?> map) {
            return normalize((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(normalizeValue(item)));
            return copy;
        }
        return value;
    }
}
