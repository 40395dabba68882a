package com.lyncx.auth.model;

import java.time.Instant;

/**
 * 簽發結果：token 字串與其有效期間（秒精度，與 JWT NumericDate 一致）
 */
public record IssuedToken(String token, Instant issuedAt, Instant expiresAt) {
}
