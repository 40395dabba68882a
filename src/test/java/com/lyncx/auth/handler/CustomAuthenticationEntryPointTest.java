package com.lyncx.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyncx.auth.filter.JwtAuthenticationFilter;
import com.lyncx.shared.error.ErrorCode;
import org.junit.jupiter.api.*;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;

import static org.assertj.core.api.Assertions.*;

/**
 * CustomAuthenticationEntryPoint 單元測試
 *
 * 覆蓋：缺少 token → 401、無效 token → 403、JSON 回應格式
 */
class CustomAuthenticationEntryPointTest {

    private CustomAuthenticationEntryPoint entryPoint;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        entryPoint = new CustomAuthenticationEntryPoint(new ObjectMapper()); // 用真實的 ObjectMapper
        request = new MockHttpServletRequest("GET", "/api/user/profile");
        request.setRemoteAddr("10.0.0.1");
        response = new MockHttpServletResponse();
    }

    @Test
    @DisplayName("沒有標記 → 401 Access token required")
    void noAttributeReturns401() throws Exception {
        entryPoint.commence(request, response,
                new InsufficientAuthenticationException("Full authentication is required"));

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentType()).startsWith("application/json");
        assertThat(response.getContentAsString()).isEqualTo("{\"error\":\"Access token required\"}");
    }

    @Test
    @DisplayName("MISSING_TOKEN → 401")
    void missingTokenReturns401() throws Exception {
        request.setAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE, ErrorCode.MISSING_TOKEN);

        entryPoint.commence(request, response,
                new InsufficientAuthenticationException("Full authentication is required"));

        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("INVALID_TOKEN → 403 Invalid or expired token")
    void invalidTokenReturns403() throws Exception {
        request.addHeader("Authorization", "Bearer expired");
        request.addHeader("X-Forwarded-For", "203.0.113.50, 70.41.3.18");
        request.setAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE, ErrorCode.INVALID_TOKEN);

        entryPoint.commence(request, response,
                new InsufficientAuthenticationException("Full authentication is required"));

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("Invalid or expired token");
    }
}
