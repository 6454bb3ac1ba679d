package com.calldash.calldash.auth;

import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    public ResponseEntity<AuthModels.AuthStatusResponse> login(
            @RequestBody AuthModels.LoginRequest request,
            HttpSession session
    ) {
        AuthModels.AuthUserResponse user = authService.login(request, session);
        return ResponseEntity.ok(new AuthModels.AuthStatusResponse(true, user));
    }

    @PostMapping("/logout")
    public ResponseEntity<AuthModels.AuthStatusResponse> logout(HttpSession session) {
        authService.logout(session);
        return ResponseEntity.ok(new AuthModels.AuthStatusResponse(false, null));
    }

    @GetMapping("/me")
    public ResponseEntity<AuthModels.AuthStatusResponse> me(HttpSession session) {
        AuthModels.AuthUserResponse user = authService.getCurrentUser(session);
        return ResponseEntity.ok(new AuthModels.AuthStatusResponse(user != null, user));
    }
}
