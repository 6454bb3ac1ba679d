package com.calldash.calldash.auth;

public final class AuthModels {

    private AuthModels() {
    }

    public static final String SESSION_USER_ID = "session_user_id";
    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_USER = "user";

    public record AuthUserResponse(long userId, String username, String email, String role) {

        public boolean isAdmin() {
            return ROLE_ADMIN.equals(role);
        }
    }

    public record AuthStatusResponse(boolean authenticated, AuthUserResponse user) {
    }

    public record LoginRequest(String username, String password) {
    }
}
