package com.contactbook.auth.api.dto;

import com.contactbook.user.domain.User;

/**
 * 面向客户端展示的用户信息，不含口令散列与令牌。
 */
public record UserView(
        Long id,
        String username,
        String email,
        String avatar
) {

    public static UserView from(User user) {
        return new UserView(user.getId(), user.getUsername(), user.getEmail(), user.getAvatar());
    }
}
