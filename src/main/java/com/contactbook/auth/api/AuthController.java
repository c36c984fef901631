package com.contactbook.auth.api;

import com.contactbook.auth.api.dto.EmailRequest;
import com.contactbook.auth.api.dto.LoginRequest;
import com.contactbook.auth.api.dto.MessageResponse;
import com.contactbook.auth.api.dto.SignupRequest;
import com.contactbook.auth.api.dto.SignupResponse;
import com.contactbook.auth.api.dto.TokenRefreshRequest;
import com.contactbook.auth.api.dto.TokenResponse;
import com.contactbook.auth.api.dto.UserView;
import com.contactbook.auth.service.AuthGate;
import com.contactbook.auth.service.AuthService;
import com.contactbook.storage.AvatarStorageService;
import com.contactbook.user.domain.User;
import com.contactbook.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * 认证 API 控制器。
 * <p>
 * 暴露 REST 接口：注册、登录、刷新令牌、邮箱确认、重发确认邮件、上传头像、查询当前用户。
 * 需要身份的接口通过 `@AuthenticationPrincipal Jwt` 注入令牌，再由 {@link AuthGate} 解析为用户。
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;
    private final AuthGate authGate;
    private final UserService userService;
    private final AvatarStorageService avatarStorageService;

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public SignupResponse signup(@Valid @RequestBody SignupRequest request) {
        return authService.signup(request, baseUrl());
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/refresh_token")
    public TokenResponse refresh(@Valid @RequestBody TokenRefreshRequest request) {
        return authService.refresh(request.refreshToken());
    }

    @GetMapping("/confirmed_email/{token}")
    public MessageResponse confirmedEmail(@PathVariable("token") String token) {
        return authService.confirmEmail(token);
    }

    @PostMapping("/request_email")
    public MessageResponse requestEmail(@Valid @RequestBody EmailRequest request) {
        return authService.requestEmail(request.email(), baseUrl());
    }

    /**
     * 上传头像并更新用户头像地址。
     *
     * <p>文件先上传到对象存储，由对象存储返回可访问 URL；再将 URL 写回用户记录。</p>
     */
    @PatchMapping("/avatar")
    public UserView updateAvatar(@AuthenticationPrincipal Jwt jwt,
                                 @RequestPart("file") MultipartFile file) {
        User user = authGate.resolveIdentity(jwt);
        String url = avatarStorageService.uploadAvatar(user.getId(), file);
        return UserView.from(userService.updateAvatar(user.getId(), url));
    }

    @GetMapping("/me")
    public UserView me(@AuthenticationPrincipal Jwt jwt) {
        return UserView.from(authGate.resolveIdentity(jwt));
    }

    private static String baseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
    }
}
