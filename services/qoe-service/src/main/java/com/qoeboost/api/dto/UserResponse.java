package com.qoeboost.api.dto;

import com.qoeboost.api.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * UserResponse - public view of a user account.
 *
 * Returned by POST /auth/register, GET /auth/me and GET /users/{id}.
 * The password hash has no field here, so it cannot leak through
 * serialization of this type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private Long id;
    private String username;
    private String email;
    private String provider;
    private Instant createdAt;
    private boolean active;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .provider(user.getProvider())
                .createdAt(user.getCreatedAt())
                .active(user.isActive())
                .build();
    }
}
