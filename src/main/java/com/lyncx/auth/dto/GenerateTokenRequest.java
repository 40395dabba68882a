package com.lyncx.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /api/auth/generate-token 請求
 *
 * 由 extension 在身分提供者登入完成後呼叫。
 * displayName / photoURL 可一併送來但不會使用：token 只帶 uid 與 email，個人資料走 PUT /api/user/profile。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateTokenRequest {

    @NotBlank(message = "uid 不可為空")
    private String uid;

    @NotBlank(message = "email 不可為空")
    private String email;

    private String displayName;

    private String photoURL;
}
