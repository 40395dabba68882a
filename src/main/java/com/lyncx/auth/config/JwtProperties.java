package com.lyncx.auth.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * JWT 設定
 *
 * 對應 application.yml:
 * lyncx:
 *   jwt:
 *     secret: ${JWT_SECRET}
 *     ttl: 7d
 */
@Getter
@ConfigurationProperties(prefix = "lyncx.jwt")
public class JwtProperties {

    /** HMAC 簽名金鑰，至少 32 bytes */
    private final String secret;

    /** 預設 token 有效期（generate-token 使用） */
    private final Duration ttl;

    public JwtProperties(String secret, @DefaultValue("7d") Duration ttl) {
        this.secret = secret;
        this.ttl = ttl;
    }
}
