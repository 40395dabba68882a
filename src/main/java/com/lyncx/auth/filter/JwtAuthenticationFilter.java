package com.lyncx.auth.filter;

import com.lyncx.auth.model.Identity;
import com.lyncx.auth.service.JwtService;
import com.lyncx.shared.error.AccountException;
import com.lyncx.shared.error.ErrorCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * JWT 認證過濾器
 *
 * 從 Authorization: Bearer {token} 標頭中提取 JWT，
 * 驗證後把 {@link Identity} 設為 SecurityContext 的 principal。
 *
 * 失敗時不直接回應，而是把原因（MISSING_TOKEN / INVALID_TOKEN）記在 request attribute，
 * 由 CustomAuthenticationEntryPoint 在受保護路徑上決定回 401 或 403；
 * 公開路徑則照常往下走。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    /** request attribute：認證失敗原因（{@link ErrorCode}） */
    public static final String AUTH_ERROR_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".AUTH_ERROR";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String token = extractBearerToken(request.getHeader("Authorization"));

        if (token == null) {
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, ErrorCode.MISSING_TOKEN);
        } else {
            try {
                Identity identity = jwtService.verify(token);

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(
                                identity,   // principal = Identity
                                null,       // credentials
                                List.of(new SimpleGrantedAuthority("ROLE_USER"))
                        );
                authentication.setDetails(
                        new WebAuthenticationDetailsSource().buildDetails(request));

                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("JWT 認證成功: uid={}", identity.subjectId());
            } catch (AccountException e) {
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, ErrorCode.INVALID_TOKEN);
                log.warn("JWT 驗證失敗 [{}]: {}", request.getRequestURI(), e.getMessage());
            } catch (RuntimeException e) {
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, ErrorCode.INVALID_TOKEN);
                log.warn("JWT 處理失敗 [{}]: {}", request.getRequestURI(), e.getMessage());
            }
        }

        filterChain.doFilter(request, response);
    }

    /**
     * 取出 Bearer token；沒有 header、非 Bearer scheme、或 token 為空時回傳 null
     */
    static String extractBearerToken(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
