package com.calldash.calldash.auth;

import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Resolves the calling user from the HTTP session. The call-data endpoints consume only
 * {@link #requireCurrentUser(HttpSession)} and {@link #requireAdmin(AuthModels.AuthUserResponse)}.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final JdbcTemplate jdbcTemplate;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties authProperties;

    public AuthService(JdbcTemplate jdbcTemplate, PasswordEncoder passwordEncoder, AuthProperties authProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.passwordEncoder = passwordEncoder;
        this.authProperties = authProperties;
        ensureUserTable();
        seedAdminUser();
    }

    /**
     * Accepts either username or email as the login name.
     */
    public AuthModels.AuthUserResponse login(AuthModels.LoginRequest request, HttpSession session) {
        String loginName = request.username() == null ? "" : request.username().trim();
        String password = request.password() == null ? "" : request.password();
        if (loginName.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Username is required");
        }

        UserRecord record = findActiveRecord(loginName);
        if (!passwordEncoder.matches(password, record.passwordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid credentials");
        }

        jdbcTemplate.update("UPDATE app_user SET last_login = ? WHERE user_id = ?", System.currentTimeMillis(), record.userId());
        session.setAttribute(AuthModels.SESSION_USER_ID, record.userId());
        return new AuthModels.AuthUserResponse(record.userId(), record.username(), record.email(), record.role());
    }

    public AuthModels.AuthUserResponse getCurrentUser(HttpSession session) {
        Object userId = session.getAttribute(AuthModels.SESSION_USER_ID);
        if (!(userId instanceof Number number)) {
            return null;
        }
        try {
            return jdbcTemplate.queryForObject(
                    "SELECT user_id, username, email, role FROM app_user WHERE user_id = ? AND active = TRUE",
                    (rs, rowNum) -> new AuthModels.AuthUserResponse(
                            rs.getLong("user_id"),
                            rs.getString("username"),
                            rs.getString("email"),
                            rs.getString("role")
                    ),
                    number.longValue()
            );
        } catch (EmptyResultDataAccessException ex) {
            session.removeAttribute(AuthModels.SESSION_USER_ID);
            return null;
        }
    }

    public AuthModels.AuthUserResponse requireCurrentUser(HttpSession session) {
        AuthModels.AuthUserResponse user = getCurrentUser(session);
        if (user == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Login required");
        }
        return user;
    }

    public void requireAdmin(AuthModels.AuthUserResponse user) {
        if (user == null || !user.isAdmin()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Admin access required");
        }
    }

    public void logout(HttpSession session) {
        session.invalidate();
    }

    private UserRecord findActiveRecord(String loginName) {
        try {
            return jdbcTemplate.queryForObject(
                    """
                    SELECT user_id, username, email, role, password_hash FROM app_user
                    WHERE (LOWER(username) = LOWER(?) OR LOWER(email) = LOWER(?)) AND active = TRUE
                    """,
                    (rs, rowNum) -> new UserRecord(
                            rs.getLong("user_id"),
                            rs.getString("username"),
                            rs.getString("email"),
                            rs.getString("role"),
                            rs.getString("password_hash")
                    ),
                    loginName,
                    loginName
            );
        } catch (EmptyResultDataAccessException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid credentials");
        }
    }

    private void seedAdminUser() {
        String username = authProperties.getAdminUsername();
        String password = authProperties.getAdminPassword();
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            return;
        }
        Integer existing = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM app_user WHERE LOWER(username) = LOWER(?)",
                Integer.class,
                username
        );
        if (existing != null && existing > 0) {
            return;
        }
        jdbcTemplate.update(
                "INSERT INTO app_user (username, email, password_hash, role, created_at, active) VALUES (?, ?, ?, ?, ?, TRUE)",
                username,
                authProperties.getAdminEmail(),
                passwordEncoder.encode(password),
                AuthModels.ROLE_ADMIN,
                System.currentTimeMillis()
        );
        log.info("Created default admin user. username={}", username);
    }

    private void ensureUserTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS app_user (
                    user_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    username VARCHAR NOT NULL UNIQUE,
                    email VARCHAR NULL,
                    password_hash VARCHAR NOT NULL,
                    role VARCHAR NOT NULL,
                    created_at BIGINT NOT NULL,
                    last_login BIGINT NULL,
                    active BOOLEAN NOT NULL
                )
                """);
    }

    private record UserRecord(long userId, String username, String email, String role, String passwordHash) {
    }
}
