package com.lyncx.store.memory;

import com.lyncx.store.DocumentAlreadyExistsException;
import com.lyncx.store.DocumentNotFoundException;
import com.lyncx.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory 文件資料庫
 *
 * 本機開發（lyncx.store.type=memory）與測試使用。
 * 寫入與讀出都做深拷貝，行為與外部資料庫一致：呼叫端拿到的 Map 改了不會影響已存資料。
 *
 * create 用 putIfAbsent、update 用 computeIfPresent，單一文件的操作都是原子的。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "lyncx.store", name = "type", havingValue = "memory")
public class InMemoryDocumentStore implements DocumentStore {

    /** key = collection → (id → document) */
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Map<String, Object>>> collections =
            new ConcurrentHashMap<>();

    @Override
    public Optional<Map<String, Object>> get(String collection, String id) {
        Map<String, Object> document = collection(collection).get(id);
        return Optional.ofNullable(document).map(InMemoryDocumentStore::deepCopy);
    }

    @Override
    public void create(String collection, String id, Map<String, Object> document) {
        Map<String, Object> previous = collection(collection).putIfAbsent(id, deepCopy(document));
        if (previous != null) {
            throw new DocumentAlreadyExistsException(collection, id);
        }
        log.debug("文件已建立: {}/{}", collection, id);
    }

    @Override
    public void update(String collection, String id, Map<String, Object> fields) {
        Map<String, Object> copy = deepCopy(fields);
        Map<String, Object> updated = collection(collection).computeIfPresent(id, (key, existing) -> {
            Map<String, Object> merged = new LinkedHashMap<>(existing);
            merged.putAll(copy);
            return merged;
        });
        if (updated == null) {
            throw new DocumentNotFoundException(collection, id);
        }
    }

    private ConcurrentHashMap<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, key -> new ConcurrentHashMap<>());
    }

    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
