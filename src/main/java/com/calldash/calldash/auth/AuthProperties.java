package com.calldash.calldash.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Seeded administrator account, bound from {@code auth.*}.
 */
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private String adminUsername = "admin";
    private String adminEmail = "admin@local";
    private String adminPassword;

    public String getAdminUsername() {
        return adminUsername;
    }

    public void setAdminUsername(String adminUsername) {
        this.adminUsername = adminUsername;
    }

    public String getAdminEmail() {
        return adminEmail;
    }

    public void setAdminEmail(String adminEmail) {
        this.adminEmail = adminEmail;
    }

    public String getAdminPassword() {
        return adminPassword;
    }

    public void setAdminPassword(String adminPassword) {
        this.adminPassword = adminPassword;
    }
}
