package com.lyncx.auth.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 已驗證的請求身分
 *
 * 由 JwtService 從有效 token 解析而來，放在 SecurityContext 的 principal。
 * 對外 JSON 沿用前端既有格式 {uid, email}。
 *
 * @param subjectId 用戶 ID（即 users 文件的 id）
 * @param email     用戶 email
 */
public record Identity(
        @JsonProperty("uid") String subjectId,
        @JsonProperty("email") String email
) {
}
