package com.todo.security;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

/**
 * Authentication details carried alongside the user id principal: the email
 * claim and the session the bearer token is bound to.
 */
@Data
@AllArgsConstructor
public class TokenDetails {

    private String email;

    private UUID sessionId;
}
