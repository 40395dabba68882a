package com.lyncx.auth.service;

import com.lyncx.auth.config.JwtProperties;
import com.lyncx.auth.model.Identity;
import com.lyncx.auth.model.IssuedToken;
import com.lyncx.shared.error.AccountException;
import com.lyncx.shared.error.ErrorCode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.RequiredTypeException;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * JWT Token 服務
 *
 * 負責 bearer token 的簽發與驗證，純計算、不做任何 I/O。
 * 使用 HMAC-SHA256 簽名，jjwt 0.12.6。
 *
 * Claims：sub / uid = 用戶 ID，email，iat，exp。
 * 舊版前端簽發的 token 只有 uid 沒有 sub，驗證時兩者皆可。
 */
@Slf4j
@Service
public class JwtService {

    static final String CLAIM_UID = "uid";
    static final String CLAIM_EMAIL = "email";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey signingKey;
    private final Duration defaultTtl;
    private final Clock clock;

    public JwtService(JwtProperties properties, Clock clock) {
        String secret = properties.getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "lyncx.jwt.secret (JWT_SECRET) 未設定或長度不足 " + MIN_SECRET_BYTES + " bytes");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.defaultTtl = properties.getTtl();
        this.clock = clock;
    }

    /**
     * 以預設有效期簽發 token
     */
    public IssuedToken issue(String subjectId, String email) {
        return issue(subjectId, email, defaultTtl);
    }

    /**
     * 簽發 token
     *
     * 相同 secret + claims + 簽發時間會得到完全相同的 token。
     *
     * @param subjectId 用戶 ID
     * @param email     用戶 email
     * @param ttl       有效期，必須 &gt; 0
     * @return token 與有效期間
     */
    public IssuedToken issue(String subjectId, String email, Duration ttl) {
        if (subjectId == null || subjectId.isBlank() || email == null || email.isBlank()) {
            throw new IllegalArgumentException("subjectId 與 email 不可為空");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl 必須大於 0");
        }

        // JWT 的 iat / exp 只有秒精度，先截斷讓回傳值與 token 內容一致
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS);

        String token = Jwts.builder()
                .subject(subjectId)
                .claim(CLAIM_UID, subjectId)
                .claim(CLAIM_EMAIL, email)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey)
                .compact();

        return new IssuedToken(token, issuedAt, expiresAt);
    }

    /**
     * 驗證 token 並取出身分
     *
     * 簽名錯誤、格式錯誤、缺少必要 claim、或 exp &lt;= now 一律視為無效。
     *
     * @param token JWT token（不含 "Bearer " 前綴）
     * @return 驗證通過的身分
     * @throws AccountException INVALID_TOKEN
     */
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AccountException(ErrorCode.INVALID_TOKEN, "token 為空");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.warn("JWT 已過期: {}", e.getMessage());
            throw new AccountException(ErrorCode.INVALID_TOKEN, "token 已過期", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT 驗證失敗: {}", e.getMessage());
            throw new AccountException(ErrorCode.INVALID_TOKEN, "token 驗證失敗", e);
        }

        // jjwt 在 now == exp 時仍視為有效，這裡要求 now 嚴格早於 exp
        Date expiration = claims.getExpiration();
        if (expiration == null || !clock.instant().isBefore(expiration.toInstant())) {
            log.warn("JWT 已過期或缺少 exp: exp={}", expiration);
            throw new AccountException(ErrorCode.INVALID_TOKEN, "token 已過期");
        }

        String subjectId;
        String email;
        try {
            subjectId = claims.getSubject();
            if (subjectId == null || subjectId.isBlank()) {
                subjectId = claims.get(CLAIM_UID, String.class);
            }
            email = claims.get(CLAIM_EMAIL, String.class);
        } catch (RequiredTypeException e) {
            log.warn("JWT claim 型別錯誤: {}", e.getMessage());
            throw new AccountException(ErrorCode.INVALID_TOKEN, "token 欄位格式錯誤", e);
        }
        if (subjectId == null || subjectId.isBlank() || email == null || email.isBlank()) {
            log.warn("JWT 缺少 uid 或 email claim");
            throw new AccountException(ErrorCode.INVALID_TOKEN, "token 缺少必要欄位");
        }

        return new Identity(subjectId, email);
    }
}
