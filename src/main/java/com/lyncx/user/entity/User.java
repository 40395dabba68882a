package com.lyncx.user.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lyncx.subscription.entity.Plan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * users 文件
 *
 * 文件 id = uid（與 token 中的 subject 相同），每個身分只會建立一次。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class User {

    private String uid;

    private String email;

    private String displayName;

    @JsonProperty("photoURL")
    private String photoURL;

    private Plan plan;

    private Instant createdAt;

    private Instant lastLogin;
}
