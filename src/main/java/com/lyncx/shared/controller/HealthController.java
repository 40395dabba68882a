package com.lyncx.shared.controller;

import com.lyncx.auth.model.Identity;
import com.lyncx.shared.util.SecurityUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康檢查（需要 JWT，extension 用來同時確認 token 仍有效）
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String SERVER_NAME = "lyncx-api";

    private final Clock clock;

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, String>> health() {
        Identity identity = SecurityUtil.getCurrentIdentity();

        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("user", identity.email());
        body.put("timestamp", clock.instant().toString());
        body.put("server", SERVER_NAME);
        return ResponseEntity.ok(body);
    }
}
