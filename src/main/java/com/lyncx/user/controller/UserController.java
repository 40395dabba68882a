package com.lyncx.user.controller;

import com.lyncx.auth.model.Identity;
import com.lyncx.shared.dto.MessageResponse;
import com.lyncx.shared.util.SecurityUtil;
import com.lyncx.subscription.entity.Plan;
import com.lyncx.user.dto.CreateUserRequest;
import com.lyncx.user.dto.CreateUserResponse;
import com.lyncx.user.dto.PlanUpdateResponse;
import com.lyncx.user.dto.UpdatePlanRequest;
import com.lyncx.user.dto.UserProfileResponse;
import com.lyncx.user.dto.UserStatsResponse;
import com.lyncx.user.entity.User;
import com.lyncx.user.entity.UserPatch;
import com.lyncx.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 用戶 / 方案 API
 *
 * 路徑：/api/user（全部需要 JWT）
 *
 * 端點：
 * - GET  /profile → 用戶資料（刷新 lastLogin）
 * - POST /create  → 建立用戶（預設 trial 方案）
 * - PUT  /plan    → 變更方案
 * - PUT  /profile → 更新 displayName / photoURL
 * - GET  /stats   → 方案統計
 */
@Slf4j
@RestController
@RequestMapping("/api/user")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    /**
     * 取得當前用戶資料
     * GET /api/user/profile
     *
     * @return {@link UserProfileResponse}，用戶不存在時 404
     */
    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> getProfile() {
        Identity identity = SecurityUtil.getCurrentIdentity();
        log.info("取得用戶資料: {}", identity.email());
        return ResponseEntity.ok(userService.getProfile(identity));
    }

    /**
     * 建立用戶
     * POST /api/user/create
     * Body: {@link CreateUserRequest}（可省略）
     *
     * @return 201 + {@link CreateUserResponse}，已存在時 409
     */
    @PostMapping("/create")
    public ResponseEntity<CreateUserResponse> createUser(
            @RequestBody(required = false) CreateUserRequest request) {
        Identity identity = SecurityUtil.getCurrentIdentity();
        String planType = request != null ? request.getPlanType() : null;
        log.info("建立用戶: {} plan={}", identity.email(), planType);

        User user = userService.createUser(identity, planType);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreateUserResponse("User created successfully", user));
    }

    /**
     * 變更方案
     * PUT /api/user/plan
     * Body: {@link UpdatePlanRequest}
     *
     * @return {@link PlanUpdateResponse}，類型不合法時 400
     */
    @PutMapping("/plan")
    public ResponseEntity<PlanUpdateResponse> updatePlan(@RequestBody UpdatePlanRequest request) {
        Identity identity = SecurityUtil.getCurrentIdentity();
        log.info("變更方案: {} → {}", identity.email(), request.getPlanType());

        Plan plan = userService.changePlan(identity, request);
        return ResponseEntity.ok(new PlanUpdateResponse("Plan updated successfully", plan));
    }

    /**
     * 更新個人資料
     * PUT /api/user/profile
     * Body: { "displayName": "...", "photoURL": "..." }
     *
     * 有出現的 key 才會寫入（包含 null），沒出現的保持不變。
     */
    @PutMapping("/profile")
    public ResponseEntity<MessageResponse> updateProfile(@RequestBody Map<String, Object> body) {
        Identity identity = SecurityUtil.getCurrentIdentity();
        log.info("更新個人資料: {}", identity.email());

        UserPatch patch = UserPatch.empty();
        if (body.containsKey(UserPatch.DISPLAY_NAME)) {
            patch.displayName(asText(body.get(UserPatch.DISPLAY_NAME)));
        }
        if (body.containsKey(UserPatch.PHOTO_URL)) {
            patch.photoURL(asText(body.get(UserPatch.PHOTO_URL)));
        }

        userService.updateProfile(identity, patch);
        return ResponseEntity.ok(new MessageResponse("Profile updated successfully"));
    }

    /**
     * 方案統計
     * GET /api/user/stats
     *
     * @return {@link UserStatsResponse}，用戶不存在時 404
     */
    @GetMapping("/stats")
    public ResponseEntity<UserStatsResponse> getStats() {
        Identity identity = SecurityUtil.getCurrentIdentity();
        return ResponseEntity.ok(userService.getStats(identity));
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
