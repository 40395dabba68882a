package com.lyncx.user.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lyncx.shared.error.AccountException;
import com.lyncx.shared.error.ErrorCode;
import com.lyncx.store.DocumentAlreadyExistsException;
import com.lyncx.store.DocumentNotFoundException;
import com.lyncx.store.DocumentStore;
import com.lyncx.store.DocumentStoreException;
import com.lyncx.user.entity.User;
import com.lyncx.user.entity.UserPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * users collection 的型別化存取
 *
 * User ↔ 文件 Map 的轉換用 Jackson（時間存成 ISO-8601 字串）。
 * 文件資料庫的例外在這裡轉成 {@link AccountException}：
 * 已存在 → ALREADY_EXISTS、不存在 → NOT_FOUND、其他 → STORE_UNAVAILABLE。
 */
@Slf4j
@Repository
public class UserStore {

    static final String COLLECTION = "users";
    static final String LAST_LOGIN = "lastLogin";

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final DocumentStore documentStore;
    private final ObjectMapper documentMapper;
    private final Clock clock;

    public UserStore(DocumentStore documentStore, ObjectMapper objectMapper, Clock clock) {
        this.documentStore = documentStore;
        this.documentMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    /**
     * 依 uid 讀取用戶
     *
     * @return 不存在時為 empty
     */
    public Optional<User> get(String uid) {
        try {
            return documentStore.get(COLLECTION, uid)
                    .map(document -> documentMapper.convertValue(document, User.class));
        } catch (DocumentStoreException e) {
            throw unavailable("get", uid, e);
        }
    }

    /**
     * 建立用戶（條件式寫入，同一 uid 只會有一個成功）
     *
     * @throws AccountException ALREADY_EXISTS 已有同 uid 的用戶
     */
    public User create(String uid, User initial) {
        initial.setUid(uid);
        try {
            documentStore.create(COLLECTION, uid, documentMapper.convertValue(initial, DOCUMENT_TYPE));
        } catch (DocumentAlreadyExistsException e) {
            log.info("用戶已存在，略過建立: uid={}", uid);
            throw new AccountException(ErrorCode.ALREADY_EXISTS, "用戶已存在: " + uid, e);
        } catch (DocumentStoreException e) {
            throw unavailable("create", uid, e);
        }
        return initial;
    }

    /**
     * 部分更新，並把 lastLogin 刷新為現在時間
     *
     * @return 寫入的 lastLogin
     * @throws AccountException NOT_FOUND 用戶不存在
     */
    public Instant update(String uid, UserPatch patch) {
        Instant now = clock.instant();

        Map<String, Object> fields = new LinkedHashMap<>();
        patch.getFields().forEach((key, value) ->
                fields.put(key, value == null ? null : documentMapper.convertValue(value, Object.class)));
        fields.put(LAST_LOGIN, documentMapper.convertValue(now, Object.class));

        try {
            documentStore.update(COLLECTION, uid, fields);
        } catch (DocumentNotFoundException e) {
            throw new AccountException(ErrorCode.NOT_FOUND, "用戶不存在: " + uid, e);
        } catch (DocumentStoreException e) {
            throw unavailable("update", uid, e);
        }
        return now;
    }

    private AccountException unavailable(String operation, String uid, DocumentStoreException e) {
        return new AccountException(ErrorCode.STORE_UNAVAILABLE,
                "users " + operation + " 失敗: uid=" + uid, e);
    }
}
