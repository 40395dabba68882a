package com.lyncx.subscription.service;

import com.lyncx.shared.error.AccountException;
import com.lyncx.shared.error.ErrorCode;
import com.lyncx.subscription.entity.Plan;
import com.lyncx.subscription.entity.PlanStatus;
import com.lyncx.subscription.entity.PlanType;
import com.lyncx.user.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 方案狀態機
 *
 * 狀態 = type × status × subscriptionEnd，只透過建立用戶與 changePlan 轉換：
 * <pre>
 * [無用戶]        --create(trial)-->      trial/active
 * &lt;type&gt;/active --changePlan(任意有效類型)--> &lt;type&gt;/active
 * </pre>
 * 任何狀態都可以換到任何有效類型，沒有終止狀態。
 *
 * 所有方法都是純函式，時間由呼叫端傳入。
 */
@Slf4j
@Component
public class PlanLifecycle {

    /** 試用期長度 */
    public static final Duration TRIAL_PERIOD = Duration.ofDays(7);

    /**
     * 新的試用方案：trial/active，到期 = now + 7 天
     */
    public Plan newTrialPlan(Instant now) {
        return Plan.builder()
                .type(PlanType.TRIAL)
                .status(PlanStatus.ACTIVE)
                .subscriptionStart(now)
                .subscriptionEnd(now.plus(TRIAL_PERIOD))
                .lastUpdated(now)
                .build();
    }

    /**
     * 建立用戶時的初始方案
     *
     * trial 自動設定到期日，其他類型不到期。
     *
     * @throws AccountException INVALID_PLAN_TYPE
     */
    public Plan initialPlan(String requestedType, Instant now) {
        PlanType type = parseType(requestedType);
        if (type == PlanType.TRIAL) {
            return newTrialPlan(now);
        }
        return Plan.builder()
                .type(type)
                .status(PlanStatus.ACTIVE)
                .subscriptionStart(now)
                .subscriptionEnd(null)
                .lastUpdated(now)
                .build();
    }

    /**
     * 變更方案
     *
     * 產生全新的 Plan：status 重設為 active、subscriptionStart = now。
     * 舊的 billing id 與自訂到期日不會保留，需由呼叫端重新提供。
     *
     * @param currentUser   目前的用戶（僅供記錄，不限制轉換）
     * @param requestedType 目標類型字串
     * @param requestedEnd  到期時間，可為 null
     * @param billingId     金流客戶 ID，可為 null
     * @param now           目前時間
     * @throws AccountException INVALID_PLAN_TYPE（不會產生任何變更）
     */
    public Plan changePlan(User currentUser, String requestedType, Instant requestedEnd,
                           String billingId, Instant now) {
        PlanType type = parseType(requestedType);

        Plan previous = currentUser != null ? currentUser.getPlan() : null;
        log.info("方案變更: uid={} {} → {}",
                currentUser != null ? currentUser.getUid() : null,
                previous != null ? previous.getType() : null,
                type);

        return Plan.builder()
                .type(type)
                .status(PlanStatus.ACTIVE)
                .subscriptionStart(now)
                .subscriptionEnd(requestedEnd)
                .externalBillingId(billingId)
                .lastUpdated(now)
                .build();
    }

    /**
     * 剩餘天數（無條件進位）
     *
     * 還剩 30 分鐘也算 1 天；已過期為 0；超過 int 範圍的遠期到期日以 Integer.MAX_VALUE 表示。
     *
     * @return 不會到期的方案回傳 null
     */
    public Integer daysRemaining(Plan plan, Instant now) {
        Instant end = plan.getSubscriptionEnd();
        if (end == null) {
            return null;
        }
        Duration remaining = Duration.between(now, end);
        if (remaining.isNegative() || remaining.isZero()) {
            return 0;
        }
        long days = remaining.toDays();
        if (!remaining.minusDays(days).isZero()) {
            days++;
        }
        return (int) Math.min(days, Integer.MAX_VALUE);
    }

    /**
     * 是否已過期：now 嚴格晚於 subscriptionEnd 才算，剛好等於到期時間仍有效
     */
    public boolean isExpired(Plan plan, Instant now) {
        Instant end = plan.getSubscriptionEnd();
        return end != null && now.isAfter(end);
    }

    /**
     * 驗證方案類型字串，只接受 free / trial / pro / plus（大小寫需完全相符）
     *
     * @throws AccountException INVALID_PLAN_TYPE
     */
    public PlanType parseType(String requestedType) {
        return PlanType.fromValue(requestedType)
                .orElseThrow(() -> new AccountException(ErrorCode.INVALID_PLAN_TYPE,
                        "不支援的方案類型: " + requestedType));
    }
}
