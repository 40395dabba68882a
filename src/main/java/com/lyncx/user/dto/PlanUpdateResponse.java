package com.lyncx.user.dto;

import com.lyncx.subscription.entity.Plan;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PlanUpdateResponse {

    private String message;
    private Plan plan;
}
