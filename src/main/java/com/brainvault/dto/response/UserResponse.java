package com.brainvault.dto.response;

import com.brainvault.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private UUID id;

    private String externalAuthId;

    private String email;

    private String subscription;

    private LocalDateTime createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .externalAuthId(user.getExternalAuthId())
                .email(user.getEmail())
                .subscription(user.getSubscription())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
