package com.lyncx.user.dto;

import com.lyncx.user.entity.User;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CreateUserResponse {

    private String message;
    private User user;
}
