package com.todo.security;

import jakarta.servlet.http.HttpServletRequest;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Client address and user agent of the request that opens a session.
 */
@Data
@AllArgsConstructor
public class RequestMetadata {

    private String ipAddress;

    private String userAgent;

    public static RequestMetadata from(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        String ip = forwarded != null && !forwarded.isBlank()
                ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
        return new RequestMetadata(ip, request.getHeader("User-Agent"));
    }
}
