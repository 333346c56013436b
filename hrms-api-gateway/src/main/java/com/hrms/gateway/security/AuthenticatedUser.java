package com.hrms.gateway.security;

/**
 * Caller identity taken from a validated bearer token.
 */
public record AuthenticatedUser(String userId, String email, String role) {

    public static final String ADMIN_ROLE = "ADMIN";

    public boolean isAdmin() {
        return ADMIN_ROLE.equals(role);
    }
}
