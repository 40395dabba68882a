package com.lyncx.shared.util;

import com.lyncx.auth.model.Identity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * 安全工具類
 *
 * 從 SecurityContext 取得當前請求的 {@link Identity}（由 JwtAuthenticationFilter 設定）。
 */
public final class SecurityUtil {

    private SecurityUtil() {
    }

    /**
     * 取得當前登入用戶的身分
     *
     * @return Identity (uid + email)
     * @throws IllegalStateException 如果用戶未登入
     */
    public static Identity getCurrentIdentity() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()
                || !(auth.getPrincipal() instanceof Identity identity)) {
            throw new IllegalStateException("用戶未登入");
        }
        return identity;
    }
}
