package com.tasknest.todoservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tasknest.todoservice.entity.User;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/** Outward view of an account. Never carries the password digest. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String username;
    private String email;
    private String role;
    private boolean emailVerified;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static UserSummary from(User user) {
        return UserSummary.builder()
                .id(user.getId() != null ? user.getId().toString() : null)
                .username(user.getUsername())
                .email(user.getEmail())
                .role(user.getRole() != null ? user.getRole().name() : null)
                .emailVerified(user.isVerified())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getModifiedAt())
                .build();
    }
}
