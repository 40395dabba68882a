package com.lyncx.store.firestore;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Firestore 連線設定（service account）
 *
 * 對應 application.yml:
 * lyncx:
 *   firestore:
 *     project-id: ${FIREBASE_PROJECT_ID}
 *     private-key-id: ${FIREBASE_PRIVATE_KEY_ID}
 *     private-key: ${FIREBASE_PRIVATE_KEY}
 *     client-email: ${FIREBASE_CLIENT_EMAIL}
 *     client-id: ${FIREBASE_CLIENT_ID}
 *
 * private-key 通常以單行環境變數傳入，字面上的 "\n" 會還原成換行。
 * 未提供 client-email / private-key 時改用 Application Default Credentials。
 */
@Getter
@ConfigurationProperties(prefix = "lyncx.firestore")
public class FirestoreProperties {

    private final String projectId;
    private final String privateKeyId;
    private final String privateKey;
    private final String clientEmail;
    private final String clientId;

    public FirestoreProperties(String projectId, String privateKeyId, String privateKey,
                               String clientEmail, String clientId) {
        this.projectId = projectId;
        this.privateKeyId = privateKeyId;
        this.privateKey = privateKey != null ? privateKey.replace("\\n", "\n") : null;
        this.clientEmail = clientEmail;
        this.clientId = clientId;
    }

    public boolean hasServiceAccount() {
        return clientEmail != null && !clientEmail.isBlank()
                && privateKey != null && !privateKey.isBlank();
    }
}
