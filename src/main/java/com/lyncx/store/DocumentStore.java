package com.lyncx.store;

import java.util.Map;
import java.util.Optional;

/**
 * 文件資料庫存取介面
 *
 * 以 (collection, id) 定位一份 JSON 文件，內容是 String / Number / Boolean / null /
 * 巢狀 Map / List 組成的樹。實作：Firestore（正式環境）與 in-memory（本機、測試）。
 *
 * 所有方法失敗時拋出 {@link DocumentStoreException} 或其子類別。
 */
public interface DocumentStore {

    /**
     * 讀取文件
     *
     * @return 文件內容；不存在時為 empty
     */
    Optional<Map<String, Object>> get(String collection, String id);

    /**
     * 條件式建立文件：文件已存在時失敗，不會覆寫。
     * 同一 id 的並發呼叫最多只有一個成功。
     *
     * @throws DocumentAlreadyExistsException 文件已存在
     */
    void create(String collection, String id, Map<String, Object> document);

    /**
     * 合併更新頂層欄位，未提供的欄位保持不變
     *
     * @throws DocumentNotFoundException 文件不存在
     */
    void update(String collection, String id, Map<String, Object> fields);
}
