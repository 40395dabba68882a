package com.lyncx.store.firestore;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.List;

/**
 * Firestore client 設定
 *
 * lyncx.store.type=firestore（預設）時啟用，啟動時建立一次，
 * 由 Spring 管理生命週期（關閉時 close）。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "lyncx.store", name = "type", havingValue = "firestore", matchIfMissing = true)
public class FirestoreConfig {

    @Bean
    public Firestore firestore(FirestoreProperties properties) throws IOException {
        GoogleCredentials credentials;
        if (properties.hasServiceAccount()) {
            credentials = ServiceAccountCredentials.fromPkcs8(
                    properties.getClientId(),
                    properties.getClientEmail(),
                    properties.getPrivateKey(),
                    properties.getPrivateKeyId(),
                    List.of());
        } else {
            log.info("未設定 Firebase service account，改用 Application Default Credentials");
            credentials = GoogleCredentials.getApplicationDefault();
        }

        FirestoreOptions.Builder builder = FirestoreOptions.newBuilder()
                .setCredentials(credentials);
        if (properties.getProjectId() != null && !properties.getProjectId().isBlank()) {
            builder.setProjectId(properties.getProjectId());
        }

        log.info("Firestore client 已建立: projectId={}", properties.getProjectId());
        return builder.build().getService();
    }
}
