package com.lyncx.subscription.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 用戶的訂閱方案（內嵌在 users 文件的 plan 欄位）
 *
 * 每次變更都整份替換，不做部分合併。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Plan {

    private PlanType type;

    private PlanStatus status;

    private Instant subscriptionStart;

    /** 到期時間；null 表示不會到期 */
    private Instant subscriptionEnd;

    /** 金流端的客戶 ID（例如 Stripe cus_xxx），原樣保存 */
    @JsonAlias("stripeCustomerId")
    private String externalBillingId;

    private Instant lastUpdated;
}
