package com.todo.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.todo.entity.User;
import com.todo.entity.UserPreference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Public view of an account. The password hash never leaves the entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserResponse {

    private UUID id;

    private String name;

    private String email;

    private String timezone;

    private String locale;

    private String avatarUrl;

    private Boolean isActive;

    private LocalDateTime emailVerifiedAt;

    private LocalDateTime lastLoginAt;

    private LocalDateTime createdAt;

    private PreferenceResponse preferences;

    public static UserResponse from(User user) {
        return from(user, null);
    }

    public static UserResponse from(User user, UserPreference preference) {
        return UserResponse.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .timezone(user.getTimezone())
                .locale(user.getLocale())
                .avatarUrl(user.getAvatarUrl())
                .isActive(user.getIsActive())
                .emailVerifiedAt(user.getEmailVerifiedAt())
                .lastLoginAt(user.getLastLoginAt())
                .createdAt(user.getCreatedAt())
                .preferences(preference != null ? PreferenceResponse.from(preference) : null)
                .build();
    }
}
