package com.lyncx.auth.dto;

import com.lyncx.auth.model.Identity;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * GET /api/auth/verify 回應：{valid: true, user: {uid, email}}
 */
@Data
@AllArgsConstructor
public class VerifyResponse {

    private boolean valid;
    private Identity user;
}
