package com.lyncx.user.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.lyncx.subscription.entity.Plan;
import com.lyncx.subscription.entity.PlanStatus;
import com.lyncx.subscription.entity.PlanType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class UserWireFormatTest {

    private static final Instant T = Instant.parse("2026-03-01T10:00:00Z");

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Nested
    @DisplayName("UpdatePlanRequest 反序列化")
    class UpdatePlanRequestJson {

        @Test
        @DisplayName("externalBillingId 與到期時間")
        void externalBillingId() throws Exception {
            UpdatePlanRequest request = objectMapper.readValue(
                    "{\"planType\":\"pro\",\"subscriptionEnd\":\"2026-04-01T00:00:00Z\",\"externalBillingId\":\"cus_123\"}",
                    UpdatePlanRequest.class);

            assertThat(request.getPlanType()).isEqualTo("pro");
            assertThat(request.getSubscriptionEnd()).isEqualTo(Instant.parse("2026-04-01T00:00:00Z"));
            assertThat(request.getExternalBillingId()).isEqualTo("cus_123");
        }

        @Test
        @DisplayName("舊版欄位 stripeCustomerId 視為 externalBillingId")
        void stripeCustomerIdAlias() throws Exception {
            UpdatePlanRequest request = objectMapper.readValue(
                    "{\"planType\":\"plus\",\"stripeCustomerId\":\"cus_legacy\"}", UpdatePlanRequest.class);

            assertThat(request.getExternalBillingId()).isEqualTo("cus_legacy");
            assertThat(request.getSubscriptionEnd()).isNull();
        }
    }

    @Nested
    @DisplayName("Plan 文件格式")
    class PlanJson {

        @Test
        @DisplayName("舊文件的 stripeCustomerId 讀成 externalBillingId，未知欄位忽略")
        void legacyDocument() throws Exception {
            Plan plan = objectMapper.readValue("""
                    {"type":"pro","status":"active","subscriptionStart":"2026-03-01T10:00:00Z",
                     "subscriptionEnd":null,"stripeCustomerId":"cus_old","lastUpdated":"2026-03-01T10:00:00Z",
                     "legacyFlag":true}
                    """, Plan.class);

            assertThat(plan.getType()).isEqualTo(PlanType.PRO);
            assertThat(plan.getStatus()).isEqualTo(PlanStatus.ACTIVE);
            assertThat(plan.getExternalBillingId()).isEqualTo("cus_old");
            assertThat(plan.getSubscriptionEnd()).isNull();
        }

        @Test
        @DisplayName("輸出小寫列舉值與 ISO-8601 時間，欄位名為 externalBillingId")
        void serialization() throws Exception {
            Plan plan = Plan.builder()
                    .type(PlanType.TRIAL)
                    .status(PlanStatus.ACTIVE)
                    .subscriptionStart(T)
                    .externalBillingId("cus_123")
                    .lastUpdated(T)
                    .build();

            JsonNode json = objectMapper.valueToTree(plan);

            assertThat(json.get("type").asText()).isEqualTo("trial");
            assertThat(json.get("status").asText()).isEqualTo("active");
            assertThat(json.get("subscriptionStart").asText()).isEqualTo("2026-03-01T10:00:00Z");
            assertThat(json.get("externalBillingId").asText()).isEqualTo("cus_123");
            assertThat(json.has("stripeCustomerId")).isFalse();
        }

        @Test
        @DisplayName("不認得的方案類型 → 反序列化失敗")
        void unknownTypeRejected() {
            assertThatThrownBy(() -> objectMapper.readValue("{\"type\":\"gold\"}", Plan.class))
                    .isInstanceOf(InvalidFormatException.class);
        }
    }

    @Nested
    @DisplayName("UserStatsResponse 序列化")
    class StatsJson {

        @Test
        @DisplayName("isExpired 欄位名、小寫列舉值、到期前的剩餘天數")
        void keys() {
            JsonNode json = objectMapper.valueToTree(UserStatsResponse.builder()
                    .planType(PlanType.TRIAL)
                    .planStatus(PlanStatus.ACTIVE)
                    .daysRemaining(7)
                    .expired(false)
                    .memberSince(T)
                    .build());

            assertThat(json.get("planType").asText()).isEqualTo("trial");
            assertThat(json.get("planStatus").asText()).isEqualTo("active");
            assertThat(json.get("daysRemaining").asInt()).isEqualTo(7);
            assertThat(json.get("isExpired").asBoolean()).isFalse();
            assertThat(json.has("expired")).isFalse();
            assertThat(json.get("memberSince").asText()).isEqualTo("2026-03-01T10:00:00Z");
        }

        @Test
        @DisplayName("不會到期的方案：daysRemaining 輸出為 null")
        void nullDaysRemaining() {
            JsonNode json = objectMapper.valueToTree(UserStatsResponse.builder()
                    .planType(PlanType.PRO)
                    .planStatus(PlanStatus.ACTIVE)
                    .daysRemaining(null)
                    .expired(false)
                    .memberSince(T)
                    .build());

            assertThat(json.has("daysRemaining")).isTrue();
            assertThat(json.get("daysRemaining").isNull()).isTrue();
        }
    }
}
