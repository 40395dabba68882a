package com.lyncx.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lyncx.subscription.entity.Plan;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * GET /api/user/profile 回應
 */
@Data
@Builder
public class UserProfileResponse {

    private String uid;
    private String email;
    private String displayName;
    @JsonProperty("photoURL")
    private String photoURL;
    private Plan plan;
    private Instant createdAt;
    private Instant lastLogin;
}
