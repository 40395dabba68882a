package com.lyncx.store.memory;

import com.lyncx.store.DocumentAlreadyExistsException;
import com.lyncx.store.DocumentNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    @Nested
    @DisplayName("create 條件式建立")
    class Create {

        @Test
        @DisplayName("新文件 → 可讀回")
        void createThenGet() {
            store.create("users", "u1", Map.of("email", "a@x.com"));

            assertThat(store.get("users", "u1")).contains(Map.of("email", "a@x.com"));
        }

        @Test
        @DisplayName("已存在 → DocumentAlreadyExistsException，原內容不變")
        void duplicateRejected() {
            store.create("users", "u1", Map.of("email", "first@x.com"));

            assertThatThrownBy(() -> store.create("users", "u1", Map.of("email", "second@x.com")))
                    .isInstanceOf(DocumentAlreadyExistsException.class);
            assertThat(store.get("users", "u1").get()).containsEntry("email", "first@x.com");
        }

        @Test
        @DisplayName("不同 collection 同 id 互不影響")
        void collectionsIsolated() {
            store.create("users", "u1", Map.of("k", "users"));
            store.create("other", "u1", Map.of("k", "other"));

            assertThat(store.get("users", "u1").get()).containsEntry("k", "users");
            assertThat(store.get("other", "u1").get()).containsEntry("k", "other");
        }

        @Test
        @DisplayName("並發建立同一 id → 只有一個成功，存下的是勝出者的內容")
        void concurrentCreateSingleWinner() throws Exception {
            int callers = 16;
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();

            for (int i = 0; i < callers; i++) {
                String caller = "caller-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.create("users", "u1", Map.of("caller", caller));
                        return true;
                    } catch (DocumentAlreadyExistsException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            List<Integer> winners = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                if (results.get(i).get(5, TimeUnit.SECONDS)) {
                    winners.add(i);
                }
            }
            executor.shutdown();

            assertThat(winners).hasSize(1);
            assertThat(store.get("users", "u1").get())
                    .containsEntry("caller", "caller-" + winners.get(0));
        }
    }

    @Nested
    @DisplayName("update 合併更新")
    class Update {

        @Test
        @DisplayName("只覆蓋提供的欄位，其他欄位保留")
        void mergesTopLevelFields() {
            store.create("users", "u1", Map.of("email", "a@x.com", "displayName", "Old"));

            store.update("users", "u1", Map.of("displayName", "New"));

            assertThat(store.get("users", "u1").get())
                    .containsEntry("email", "a@x.com")
                    .containsEntry("displayName", "New");
        }

        @Test
        @DisplayName("可以把欄位設成 null")
        void nullValueWritten() {
            store.create("users", "u1", Map.of("photoURL", "http://img"));
            Map<String, Object> fields = new HashMap<>();
            fields.put("photoURL", null);

            store.update("users", "u1", fields);

            assertThat(store.get("users", "u1").get()).containsEntry("photoURL", null);
        }

        @Test
        @DisplayName("不存在 → DocumentNotFoundException，不會建立文件")
        void missingDocument() {
            assertThatThrownBy(() -> store.update("users", "ghost", Map.of("a", 1)))
                    .isInstanceOf(DocumentNotFoundException.class);
            assertThat(store.get("users", "ghost")).isEmpty();
        }
    }

    @Test
    @DisplayName("讀出的文件是複本，修改不影響已存資料")
    void returnsDefensiveCopies() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("type", "trial");
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("plan", nested);
        store.create("users", "u1", document);

        nested.put("type", "pro");
        @SuppressWarnings("unchecked")
        Map<String, Object> readPlan = (Map<String, Object>) store.get("users", "u1").get().get("plan");
        readPlan.put("type", "plus");

        @SuppressWarnings("unchecked")
        Map<String, Object> storedPlan = (Map<String, Object>) store.get("users", "u1").get().get("plan");
        assertThat(storedPlan).containsEntry("type", "trial");
    }
}
