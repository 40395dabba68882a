package com.lyncx.user.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * PUT /api/user/plan 請求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePlanRequest {

    /** 目標方案：free / trial / pro / plus */
    private String planType;

    /** 到期時間（ISO-8601），不提供表示不到期 */
    private Instant subscriptionEnd;

    /** 金流客戶 ID，舊版前端送 stripeCustomerId */
    @JsonAlias("stripeCustomerId")
    private String externalBillingId;
}
