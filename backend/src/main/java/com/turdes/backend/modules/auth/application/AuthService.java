package com.turdes.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.turdes.backend.global.config.AuthProperties;
import com.turdes.backend.global.error.ProblemException;
import com.turdes.backend.global.error.ProblemKind;
import com.turdes.backend.modules.auth.domain.AppUser;
import com.turdes.backend.modules.auth.domain.Role;
import com.turdes.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.turdes.backend.modules.auth.presentation.dto.LoginRequest;
import com.turdes.backend.modules.auth.presentation.dto.LoginResponse;
import com.turdes.backend.modules.auth.presentation.dto.MessageResponse;
import com.turdes.backend.modules.auth.presentation.dto.RegisterRequest;
import com.turdes.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.turdes.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.turdes.backend.modules.notification.application.AccountNotificationSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Account lifecycle: registration, e-mail verification, login, refresh-token rotation and password changes.
 *
 * <p>Notification sends are best effort. A failed send is logged and never undoes the state change
 * that triggered it.</p>
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String MSG_REGISTERED = "User registered successfully. Please verify your email.";
    static final String MSG_EMAIL_VERIFIED = "Email verified successfully";
    static final String MSG_VERIFICATION_SENT = "Verification email sent";
    static final String MSG_RESET_REQUESTED = "If an account exists for this email, a password reset link has been sent";
    static final String MSG_PASSWORD_UPDATED = "Password updated successfully";
    static final String MSG_PASSWORD_RESET = "Password reset successfully";

    private static final String VERIFY_EMAIL_PATH = "/api/auth/verify-email";
    private static final String RESET_PASSWORD_PATH = "/reset-password";

    private final AppUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final OneTimeTokenGenerator tokenGenerator;
    private final AccountNotificationSender notificationSender;
    private final AuthProperties properties;
    private final Clock clock;

    public AuthService(
            AppUserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            OneTimeTokenGenerator tokenGenerator,
            AccountNotificationSender notificationSender,
            AuthProperties properties,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.tokenGenerator = tokenGenerator;
        this.notificationSender = notificationSender;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs without a surrounding transaction so that a unique-constraint failure inside
     * {@code saveAndFlush} rolls back only its own unit of work and surfaces as a conflict.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public MessageResponse register(RegisterRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw emailAlreadyRegistered();
        }
        requireStrongPassword(request.password());

        AppUser user = new AppUser();
        user.setEmail(request.email());
        user.setName(request.name());
        user.setPhone(request.phone());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(Role.USER);
        String verificationToken = tokenGenerator.generate();
        user.issueVerificationToken(verificationToken, OffsetDateTime.now(clock).plus(properties.verification().tokenTtl()));

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // concurrent sign-up with the same address won the unique constraint
            throw emailAlreadyRegistered();
        }
        log.info("Registered user {} ({})", user.getId(), user.getEmail());

        AppUser registered = user;
        String link = verificationLink(registered.getEmail(), verificationToken);
        notifyQuietly("verification", registered.getEmail(),
                () -> notificationSender.sendVerification(registered.getEmail(), registered.getName(), link));
        return new MessageResponse(MSG_REGISTERED);
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = userRepository.findByEmail(request.email())
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(ProblemKind.UNAUTHORIZED, "INVALID_CREDENTIALS",
                        "Invalid email or password"));

        if (!user.isEmailVerified()) {
            throw new ProblemException(ProblemKind.UNAUTHORIZED, "EMAIL_NOT_VERIFIED",
                    "Please verify your email before logging in");
        }

        TokenPairResponse tokens = issueAndStore(user);
        log.info("User {} logged in", user.getId());
        return new LoginResponse(
                tokens.accessToken(),
                tokens.refreshToken(),
                tokens.tokenType(),
                tokens.expiresIn(),
                user.getRole().getCode(),
                user.getId()
        );
    }

    public TokenPairResponse refresh(String refreshToken) {
        if (!StringUtils.hasText(refreshToken)) {
            throw new ProblemException(ProblemKind.BAD_REQUEST, "REFRESH_TOKEN_REQUIRED", "Refresh token is required");
        }

        TokenVerification verification = jwtTokenService.verify(refreshToken, TokenType.REFRESH);
        if (!(verification instanceof TokenVerification.Verified verified)) {
            throw invalidRefreshToken();
        }

        AppUser user = userRepository
                .findByIdAndRefreshTokenHash(verified.claims().userId(), tokenGenerator.sha256Hex(refreshToken))
                .orElseThrow(AuthService::invalidRefreshToken);

        TokenPairResponse tokens = issueAndStore(user);
        log.info("Rotated refresh token for user {}", user.getId());
        return tokens;
    }

    /**
     * Ends the session bound to the refresh token. Unknown, stale and malformed tokens are ignored so the
     * response never reveals whether a token was valid.
     */
    public void logout(String refreshToken) {
        if (!(jwtTokenService.verify(refreshToken, TokenType.REFRESH) instanceof TokenVerification.Verified verified)) {
            return;
        }
        userRepository.findByIdAndRefreshTokenHash(verified.claims().userId(), tokenGenerator.sha256Hex(refreshToken))
                .ifPresent(user -> {
                    user.setRefreshTokenHash(null);
                    log.info("User {} logged out", user.getId());
                });
    }

    public MessageResponse verifyEmail(String email, String token) {
        AppUser user = userRepository.findByEmail(email)
                .filter(candidate -> tokenGenerator.matches(candidate.getVerificationToken(), token))
                .orElseThrow(() -> new ProblemException(ProblemKind.BAD_REQUEST, "INVALID_VERIFICATION_TOKEN",
                        "Invalid verification token"));

        if (user.isVerificationTokenExpired(OffsetDateTime.now(clock))) {
            throw new ProblemException(ProblemKind.BAD_REQUEST, "VERIFICATION_TOKEN_EXPIRED",
                    "Verification token has expired, please request a new one");
        }

        user.markEmailVerified();
        log.info("Email verified for user {}", user.getId());
        notifyQuietly("welcome", user.getEmail(), () -> notificationSender.sendWelcome(user.getEmail(), user.getName()));
        return new MessageResponse(MSG_EMAIL_VERIFIED);
    }

    public MessageResponse resendVerificationEmail(String email) {
        AppUser user = userRepository.findByEmail(email)
                .filter(candidate -> !candidate.isEmailVerified())
                .orElseThrow(() -> new ProblemException(ProblemKind.BAD_REQUEST, "INVALID_REQUEST", "Invalid request"));

        String verificationToken = tokenGenerator.generate();
        user.issueVerificationToken(verificationToken, OffsetDateTime.now(clock).plus(properties.verification().tokenTtl()));
        log.info("Issued a new verification token for user {}", user.getId());

        String link = verificationLink(user.getEmail(), verificationToken);
        notifyQuietly("verification", user.getEmail(),
                () -> notificationSender.sendVerification(user.getEmail(), user.getName(), link));
        return new MessageResponse(MSG_VERIFICATION_SENT);
    }

    public MessageResponse requestPasswordReset(String email) {
        userRepository.findByEmail(email)
                .filter(AppUser::isEmailVerified)
                .ifPresent(user -> {
                    String resetToken = tokenGenerator.generate();
                    user.issuePasswordResetToken(tokenGenerator.sha256Hex(resetToken),
                            OffsetDateTime.now(clock).plus(properties.password().resetTokenTtl()));
                    log.info("Password reset requested for user {}", user.getId());

                    String link = resetLink(user.getEmail(), resetToken);
                    notifyQuietly("password reset", user.getEmail(),
                            () -> notificationSender.sendPasswordReset(user.getEmail(), user.getName(), link));
                });
        return new MessageResponse(MSG_RESET_REQUESTED);
    }

    public MessageResponse resetPassword(String email, String newPassword, String currentPassword) {
        AppUser user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "USER_NOT_FOUND", "User not found"));

        if (!user.isEmailVerified()) {
            throw new ProblemException(ProblemKind.BAD_REQUEST, "EMAIL_NOT_VERIFIED", "Email address is not verified");
        }
        requireStrongPassword(newPassword);
        if (StringUtils.hasLength(currentPassword) && !passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw new ProblemException(ProblemKind.BAD_REQUEST, "INVALID_CURRENT_PASSWORD", "Current password is incorrect");
        }

        changePassword(user, newPassword);
        return new MessageResponse(MSG_PASSWORD_UPDATED);
    }

    public MessageResponse completePasswordReset(String email, String token, String newPassword) {
        AppUser user = userRepository.findByEmail(email)
                .filter(candidate -> token != null
                        && tokenGenerator.matches(candidate.getPasswordResetToken(), tokenGenerator.sha256Hex(token)))
                .orElseThrow(() -> new ProblemException(ProblemKind.BAD_REQUEST, "INVALID_RESET_TOKEN",
                        "Invalid password reset token"));

        if (user.isPasswordResetTokenExpired(OffsetDateTime.now(clock))) {
            throw new ProblemException(ProblemKind.BAD_REQUEST, "RESET_TOKEN_EXPIRED",
                    "Password reset token has expired, please request a new one");
        }
        requireStrongPassword(newPassword);

        user.clearPasswordResetToken();
        changePassword(user, newPassword);
        return new MessageResponse(MSG_PASSWORD_RESET);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(Long userId) {
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getPhone(),
                user.getRole().getCode(),
                user.isEmailVerified(),
                user.getCreatedAt()
        );
    }

    private TokenPairResponse issueAndStore(AppUser user) {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user);
        user.setRefreshTokenHash(tokenGenerator.sha256Hex(tokens.refreshToken()));
        userRepository.save(user);
        return tokens;
    }

    private void changePassword(AppUser user, String newPassword) {
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        if (properties.password().revokeSessionsOnChange()) {
            user.setRefreshTokenHash(null);
        }
        userRepository.save(user);
        log.info("Password changed for user {}", user.getId());
    }

    private void requireStrongPassword(String password) {
        int minLength = properties.password().minLength();
        if (password == null || password.length() < minLength) {
            throw new ProblemException(ProblemKind.BAD_REQUEST, "WEAK_PASSWORD",
                    "Password must be at least " + minLength + " characters long");
        }
    }

    private void notifyQuietly(String kind, String recipient, Runnable send) {
        try {
            send.run();
        } catch (RuntimeException ex) {
            log.warn("Failed to send {} notification to {}", kind, recipient, ex);
        }
    }

    private String verificationLink(String email, String token) {
        return UriComponentsBuilder.fromHttpUrl(properties.frontendBaseUrl())
                .path(VERIFY_EMAIL_PATH)
                .queryParam("token", token)
                .queryParam("email", email)
                .toUriString();
    }

    private String resetLink(String email, String token) {
        return UriComponentsBuilder.fromHttpUrl(properties.frontendBaseUrl())
                .path(RESET_PASSWORD_PATH)
                .queryParam("token", token)
                .queryParam("email", email)
                .toUriString();
    }

    private static ProblemException emailAlreadyRegistered() {
        return new ProblemException(ProblemKind.CONFLICT, "EMAIL_ALREADY_REGISTERED", "Email is already registered");
    }

    private static ProblemException invalidRefreshToken() {
        return new ProblemException(ProblemKind.UNAUTHORIZED, "INVALID_REFRESH_TOKEN",
                "Refresh token expired or invalid, please log in again");
    }
}
