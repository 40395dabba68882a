package com.lyncx.user.service;

import com.lyncx.auth.model.Identity;
import com.lyncx.shared.error.AccountException;
import com.lyncx.shared.error.ErrorCode;
import com.lyncx.subscription.entity.Plan;
import com.lyncx.subscription.entity.PlanType;
import com.lyncx.subscription.service.PlanLifecycle;
import com.lyncx.user.dto.UpdatePlanRequest;
import com.lyncx.user.dto.UserProfileResponse;
import com.lyncx.user.dto.UserStatsResponse;
import com.lyncx.user.entity.User;
import com.lyncx.user.entity.UserPatch;
import com.lyncx.user.repository.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * 用戶與方案服務
 *
 * 串接 UserStore 與 PlanLifecycle，處理 /api/user/** 的業務邏輯。
 * 身分一律來自已驗證的 token，不接受 request body 指定 uid。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserStore userStore;
    private final PlanLifecycle planLifecycle;
    private final Clock clock;

    /**
     * 取得用戶資料，同時刷新 lastLogin
     *
     * @throws AccountException NOT_FOUND
     */
    public UserProfileResponse getProfile(Identity identity) {
        User user = findUser(identity);
        Instant lastLogin = userStore.update(identity.subjectId(), UserPatch.empty());

        return UserProfileResponse.builder()
                .uid(identity.subjectId())
                .email(identity.email())
                .displayName(user.getDisplayName())
                .photoURL(user.getPhotoURL())
                .plan(user.getPlan())
                .createdAt(user.getCreatedAt())
                .lastLogin(lastLogin)
                .build();
    }

    /**
     * 建立用戶
     *
     * @param planType 初始方案，null 或空白時為 trial
     * @throws AccountException INVALID_PLAN_TYPE / ALREADY_EXISTS
     */
    public User createUser(Identity identity, String planType) {
        String requestedType = planType == null || planType.isBlank()
                ? PlanType.TRIAL.getValue()
                : planType;
        Instant now = clock.instant();
        Plan plan = planLifecycle.initialPlan(requestedType, now);

        User user = User.builder()
                .uid(identity.subjectId())
                .email(identity.email())
                .displayName(null)
                .photoURL(null)
                .plan(plan)
                .createdAt(now)
                .lastLogin(now)
                .build();

        User created = userStore.create(identity.subjectId(), user);
        log.info("用戶建立成功: uid={} email={} plan={}",
                identity.subjectId(), identity.email(), plan.getType().getValue());
        return created;
    }

    /**
     * 變更方案（整份替換）
     *
     * 先驗證類型再查用戶：類型不合法時一律 400，不會寫入任何資料。
     *
     * @throws AccountException INVALID_PLAN_TYPE / NOT_FOUND
     */
    public Plan changePlan(Identity identity, UpdatePlanRequest request) {
        planLifecycle.parseType(request.getPlanType());
        User current = findUser(identity);
        Plan plan = planLifecycle.changePlan(current,
                request.getPlanType(),
                request.getSubscriptionEnd(),
                request.getExternalBillingId(),
                clock.instant());

        userStore.update(identity.subjectId(), UserPatch.ofPlan(plan));
        log.info("方案已更新: uid={} plan={}", identity.subjectId(), plan.getType().getValue());
        return plan;
    }

    /**
     * 更新個人資料，只寫入 patch 中提供的欄位
     *
     * @throws AccountException NOT_FOUND
     */
    public void updateProfile(Identity identity, UserPatch patch) {
        userStore.update(identity.subjectId(), patch);
        log.info("個人資料已更新: uid={} fields={}", identity.subjectId(), patch.getFields().keySet());
    }

    /**
     * 方案統計：剩餘天數、是否過期、加入時間
     *
     * @throws AccountException NOT_FOUND
     */
    public UserStatsResponse getStats(Identity identity) {
        User user = findUser(identity);
        Plan plan = user.getPlan();
        if (plan == null) {
            throw new AccountException(ErrorCode.STORE_UNAVAILABLE,
                    "users 文件缺少 plan: uid=" + identity.subjectId());
        }
        Instant now = clock.instant();

        return UserStatsResponse.builder()
                .planType(plan.getType())
                .planStatus(plan.getStatus())
                .daysRemaining(planLifecycle.daysRemaining(plan, now))
                .expired(planLifecycle.isExpired(plan, now))
                .memberSince(user.getCreatedAt())
                .build();
    }

    private User findUser(Identity identity) {
        return userStore.get(identity.subjectId())
                .orElseThrow(() -> new AccountException(ErrorCode.NOT_FOUND,
                        "用戶不存在: uid=" + identity.subjectId()));
    }
}
