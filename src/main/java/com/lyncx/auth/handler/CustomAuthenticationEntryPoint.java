package com.lyncx.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyncx.auth.filter.JwtAuthenticationFilter;
import com.lyncx.shared.dto.ErrorResponse;
import com.lyncx.shared.error.ErrorCode;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 自定義認證進入點
 *
 * 受保護路徑上沒有通過 JWT 認證時觸發，依 JwtAuthenticationFilter 記下的原因回應：
 * - 沒有 Authorization header / 不是 Bearer → 401 Access token required
 * - token 存在但驗證失敗（過期、簽名錯誤、格式錯誤）→ 403 Invalid or expired token
 *
 * 回傳統一的 JSON 格式而非 HTML 頁面。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException)
            throws IOException, ServletException {

        ErrorCode errorCode = resolveErrorCode(request);

        log.warn("認證失敗 [{}] IP={} Reason={}",
                request.getRequestURI(), getClientIp(request), errorCode);

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setStatus(errorCode.getStatus().value());

        ErrorResponse errorResponse = ErrorResponse.builder()
                .error(errorCode.getMessage())
                .build();

        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }

    private ErrorCode resolveErrorCode(HttpServletRequest request) {
        Object attribute = request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE);
        if (attribute instanceof ErrorCode errorCode) {
            return errorCode;
        }
        return ErrorCode.MISSING_TOKEN;
    }

    /**
     * 從 request 中提取真實的客戶端 IP
     * 支援：直連 IP、X-Forwarded-For、X-Real-IP
     */
    private String getClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return realIp;
        }

        return request.getRemoteAddr();
    }
}
