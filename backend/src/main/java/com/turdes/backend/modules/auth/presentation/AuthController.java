package com.turdes.backend.modules.auth.presentation;

import com.turdes.backend.global.web.ClientAddressResolver;
import com.turdes.backend.modules.auth.application.AuthService;
import com.turdes.backend.modules.auth.presentation.dto.ConfirmPasswordResetRequest;
import com.turdes.backend.modules.auth.presentation.dto.EmailRequest;
import com.turdes.backend.modules.auth.presentation.dto.LoginRequest;
import com.turdes.backend.modules.auth.presentation.dto.LoginResponse;
import com.turdes.backend.modules.auth.presentation.dto.LogoutRequest;
import com.turdes.backend.modules.auth.presentation.dto.MessageResponse;
import com.turdes.backend.modules.auth.presentation.dto.RefreshRequest;
import com.turdes.backend.modules.auth.presentation.dto.RegisterRequest;
import com.turdes.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.turdes.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.turdes.backend.modules.auth.presentation.dto.VerifyEmailRequest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final ResendVerificationThrottle resendThrottle;

    public AuthController(AuthService authService, ResendVerificationThrottle resendThrottle) {
        this.authService = authService;
        this.resendThrottle = resendThrottle;
    }

    @PostMapping("/register")
    public ResponseEntity<MessageResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken()));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestBody LogoutRequest request) {
        authService.logout(request.refreshToken());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/verify-email")
    public ResponseEntity<MessageResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        return ResponseEntity.ok(authService.verifyEmail(request.email(), request.token()));
    }

    // target of the link in the verification e-mail
    @GetMapping("/verify-email")
    public ResponseEntity<MessageResponse> verifyEmailLink(@RequestParam String email, @RequestParam String token) {
        return ResponseEntity.ok(authService.verifyEmail(email, token));
    }

    @PostMapping("/resend-verification")
    public ResponseEntity<MessageResponse> resendVerification(@Valid @RequestBody EmailRequest request,
                                                              HttpServletRequest httpRequest) {
        resendThrottle.acquire(ClientAddressResolver.resolve(httpRequest));
        return ResponseEntity.ok(authService.resendVerificationEmail(request.email()));
    }

    @PostMapping("/request-password-reset")
    public ResponseEntity<MessageResponse> requestPasswordReset(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(authService.requestPasswordReset(request.email()));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(authService.resetPassword(request.email(), request.newPassword(), request.currentPassword()));
    }

    @PostMapping("/reset-password/confirm")
    public ResponseEntity<MessageResponse> confirmPasswordReset(@Valid @RequestBody ConfirmPasswordResetRequest request) {
        return ResponseEntity.ok(authService.completePasswordReset(request.email(), request.token(), request.newPassword()));
    }
}
