package com.contactbook.auth.service;

import com.contactbook.auth.api.dto.LoginRequest;
import com.contactbook.auth.api.dto.MessageResponse;
import com.contactbook.auth.api.dto.SignupRequest;
import com.contactbook.auth.api.dto.SignupResponse;
import com.contactbook.auth.api.dto.TokenResponse;
import com.contactbook.auth.api.dto.UserView;
import com.contactbook.auth.notification.ConfirmationNotice;
import com.contactbook.auth.notification.NotificationScheduler;
import com.contactbook.auth.password.PasswordHasher;
import com.contactbook.auth.token.JwtService;
import com.contactbook.auth.token.TokenPair;
import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;
import com.contactbook.common.util.TextNormalizer;
import com.contactbook.user.domain.User;
import com.contactbook.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Optional;

/**
 * 认证业务服务。
 * <p>
 * 职责：注册、登录、刷新令牌、邮箱确认与重发确认邮件。
 * 安全策略：
 * - 登录要求邮箱已确认；
 * - 每个用户只保存一个有效的 Refresh Token，每次登录/刷新都会替换；
 * - 出示的 Refresh Token 与已保存值不一致时视为重放，清空已保存值并要求重新登录。
 * 本类不开启事务：令牌清空必须在抛出认证失败之前独立提交。
 * 已知限制：同一用户的并发刷新没有加锁，两个请求可能同时读到旧令牌并都成功。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String SIGNUP_DETAIL = "User successfully created";
    static final String EMAIL_CONFIRMED = "Email confirmed";
    static final String ALREADY_CONFIRMED = "Your email is already confirmed";
    static final String CHECK_EMAIL = "Check your email for confirmation.";

    static final int USERNAME_MIN = 6;
    static final int USERNAME_MAX = 12;

    private final UserService userService;
    private final PasswordHasher passwordHasher;
    private final JwtService jwtService;
    private final NotificationScheduler notificationScheduler;

    public SignupResponse signup(SignupRequest request, String baseUrl) {
        String email = normalizeEmail(request.email());
        String username = TextNormalizer.trimToLength(request.username(), "username", USERNAME_MIN, USERNAME_MAX);
        if (userService.existsByEmail(email) || userService.existsByUsername(username)) {
            throw new BusinessException(ErrorCode.ACCOUNT_EXISTS);
        }
        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordHasher.hash(request.password()))
                .build();
        userService.createUser(user);
        log.info("User registered id={} username={}", user.getId(), user.getUsername());
        notificationScheduler.schedule(new ConfirmationNotice(user.getEmail(), user.getUsername(), baseUrl));
        return new SignupResponse(UserView.from(user), SIGNUP_DETAIL);
    }

    /**
     * 登录失败的三种原因（邮箱不存在/未确认/口令错误）对客户端可区分，沿用既有行为。
     */
    public TokenResponse login(LoginRequest request) {
        String email = normalizeEmail(request.username());
        Optional<User> userOptional = userService.findByEmail(email);
        if (userOptional.isEmpty()) {
            log.info("Login rejected: unknown email");
            throw new BusinessException(ErrorCode.INVALID_EMAIL);
        }
        User user = userOptional.get();
        if (!user.isConfirmed()) {
            log.info("Login rejected: email not confirmed, userId={}", user.getId());
            throw new BusinessException(ErrorCode.EMAIL_NOT_CONFIRMED);
        }
        if (!passwordHasher.verify(request.password(), user.getPasswordHash())) {
            log.info("Login rejected: wrong password, userId={}", user.getId());
            throw new BusinessException(ErrorCode.INVALID_PASSWORD);
        }
        TokenPair tokenPair = jwtService.issueTokenPair(user);
        userService.updateToken(user, tokenPair.refreshToken());
        log.info("Login succeeded userId={}", user.getId());
        return TokenResponse.bearer(tokenPair);
    }

    public TokenResponse refresh(String refreshToken) {
        long userId = jwtService.decodeRefreshToken(refreshToken);
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.REFRESH_TOKEN_INVALID));
        if (!sameToken(user.getRefreshToken(), refreshToken)) {
            log.warn("Refresh token reuse detected, revoking stored token userId={}", userId);
            userService.updateToken(user, null);
            throw new BusinessException(ErrorCode.REFRESH_TOKEN_INVALID);
        }
        TokenPair tokenPair = jwtService.issueTokenPair(user);
        userService.updateToken(user, tokenPair.refreshToken());
        return TokenResponse.bearer(tokenPair);
    }

    public MessageResponse confirmEmail(String token) {
        String email = jwtService.decodeEmailToken(token);
        User user = userService.findByEmail(email)
                .orElseThrow(() -> new BusinessException(ErrorCode.VERIFICATION_ERROR));
        if (user.isConfirmed()) {
            return new MessageResponse(ALREADY_CONFIRMED);
        }
        userService.confirmEmail(email);
        log.info("Email confirmed userId={}", user.getId());
        return new MessageResponse(EMAIL_CONFIRMED);
    }

    /**
     * 重发确认邮件。邮箱未注册时同样返回通用提示。
     */
    public MessageResponse requestEmail(String email, String baseUrl) {
        Optional<User> userOptional = userService.findByEmail(normalizeEmail(email));
        if (userOptional.isPresent()) {
            User user = userOptional.get();
            if (user.isConfirmed()) {
                return new MessageResponse(ALREADY_CONFIRMED);
            }
            notificationScheduler.schedule(new ConfirmationNotice(user.getEmail(), user.getUsername(), baseUrl));
        }
        return new MessageResponse(CHECK_EMAIL);
    }

    private static boolean sameToken(String stored, String presented) {
        if (stored == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(stored.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
