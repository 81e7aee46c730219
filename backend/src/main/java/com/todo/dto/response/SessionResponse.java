package com.todo.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.todo.entity.UserSession;
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
public class SessionResponse {

    private UUID id;

    private String ipAddress;

    private String deviceType;

    private String browser;

    private String platform;

    private LocalDateTime lastActivity;

    private LocalDateTime expiresAt;

    private LocalDateTime createdAt;

    @JsonProperty("is_current")
    private boolean isCurrent;

    public static SessionResponse from(UserSession session, UUID currentSessionId) {
        return SessionResponse.builder()
                .id(session.getId())
                .ipAddress(session.getIpAddress())
                .deviceType(session.getDeviceType())
                .browser(session.getBrowser())
                .platform(session.getPlatform())
                .lastActivity(session.getLastActivity())
                .expiresAt(session.getExpiresAt())
                .createdAt(session.getCreatedAt())
                .isCurrent(session.getId().equals(currentSessionId))
                .build();
    }
}
