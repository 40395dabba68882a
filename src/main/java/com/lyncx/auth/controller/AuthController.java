package com.lyncx.auth.controller;

import com.lyncx.auth.dto.GenerateTokenRequest;
import com.lyncx.auth.dto.TokenResponse;
import com.lyncx.auth.dto.VerifyResponse;
import com.lyncx.auth.model.Identity;
import com.lyncx.auth.model.IssuedToken;
import com.lyncx.auth.service.JwtService;
import com.lyncx.shared.dto.MessageResponse;
import com.lyncx.shared.util.SecurityUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final JwtService jwtService;

    /**
     * 驗證 token
     * GET /api/auth/verify
     *
     * 能走到這裡代表 JwtAuthenticationFilter 已驗證通過。
     *
     * @return {@link VerifyResponse}
     */
    @GetMapping("/verify")
    public ResponseEntity<VerifyResponse> verify() {
        Identity identity = SecurityUtil.getCurrentIdentity();
        return ResponseEntity.ok(new VerifyResponse(true, identity));
    }

    /**
     * 簽發 token（公開端點）
     * POST /api/auth/generate-token
     * Body: {@link GenerateTokenRequest}
     *
     * @return {@link TokenResponse}，缺少 uid / email 時 400
     */
    @PostMapping("/generate-token")
    public ResponseEntity<TokenResponse> generateToken(@Valid @RequestBody GenerateTokenRequest request) {
        IssuedToken issued = jwtService.issue(request.getUid(), request.getEmail());
        log.info("已簽發 extension token: email={} expiresAt={}", request.getEmail(), issued.expiresAt());
        return ResponseEntity.ok(new TokenResponse(issued.token()));
    }

    /**
     * 登出
     * POST /api/auth/logout
     *
     * 沒有 token 黑名單，只回應確認；token 會在到期後自然失效。
     */
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout() {
        Identity identity = SecurityUtil.getCurrentIdentity();
        log.info("用戶登出: {}", identity.email());
        return ResponseEntity.ok(new MessageResponse("Logged out successfully"));
    }
}
