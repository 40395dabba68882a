package com.lyncx.auth.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * CORS 設定
 *
 * 對應 application.yml:
 * lyncx:
 *   cors:
 *     allowed-origins: chrome-extension://*,https://lyncx.ai,http://localhost:3000
 */
@Getter
@ConfigurationProperties(prefix = "lyncx.cors")
public class CorsProperties {

    /** 允許的來源，支援萬用字元（origin pattern） */
    private final List<String> allowedOrigins;

    public CorsProperties(
            @DefaultValue({"chrome-extension://*", "https://lyncx.ai", "http://localhost:3000"})
            List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
}
