package com.lyncx.shared.controller;

import com.lyncx.auth.model.Identity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HealthControllerTest {

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("回傳 healthy、當前用戶 email、時間與服務名稱")
    void healthy() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(new Identity("u1", "a@x.com"), null, List.of()));

        ResponseEntity<Map<String, String>> response =
                new HealthController(Clock.fixed(now, ZoneOffset.UTC)).health();

        assertThat(response.getBody())
                .containsEntry("status", "healthy")
                .containsEntry("user", "a@x.com")
                .containsEntry("timestamp", "2026-03-01T10:00:00Z")
                .containsEntry("server", "lyncx-api");
    }
}
