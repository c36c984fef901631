package com.contactbook.auth.service;

import com.contactbook.auth.token.JwtService;
import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;
import com.contactbook.common.exception.InvalidTokenException;
import com.contactbook.user.domain.User;
import com.contactbook.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * 把访问令牌解析为当前操作用户。只读取用户，不做任何修改。
 */
@Component
@RequiredArgsConstructor
public class AuthGate {

    private final JwtService jwtService;
    private final UserService userService;

    public User resolveIdentity(String accessToken) {
        return loadUser(jwtService.decodeAccessToken(accessToken));
    }

    public User resolveIdentity(Jwt jwt) {
        return loadUser(jwtService.requireAccessToken(jwt));
    }

    private User loadUser(long userId) {
        // 用户已被删除时令牌随之失效
        User user = userService.findById(userId).orElseThrow(InvalidTokenException::new);
        if (!user.isConfirmed()) {
            throw new BusinessException(ErrorCode.EMAIL_NOT_CONFIRMED);
        }
        return user;
    }
}
