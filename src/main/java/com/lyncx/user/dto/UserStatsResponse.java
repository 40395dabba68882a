package com.lyncx.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lyncx.subscription.entity.PlanStatus;
import com.lyncx.subscription.entity.PlanType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * GET /api/user/stats 回應
 */
@Data
@Builder
public class UserStatsResponse {

    private PlanType planType;
    private PlanStatus planStatus;

    /** 不會到期的方案為 null */
    private Integer daysRemaining;

    @JsonProperty("isExpired")
    private boolean expired;

    private Instant memberSince;
}
