package com.contactbook.user.service;

import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;
import com.contactbook.user.domain.User;
import com.contactbook.user.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 用户凭据存储。
 * <p>
 * 独占用户记录的生命周期：注册写入、刷新令牌替换/清空、邮箱确认、头像地址更新。
 * 每个写操作各自开启事务，调用方失败不会回滚已提交的令牌清空。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserMapper userMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(userMapper.findByEmail(email));
    }

    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return Optional.ofNullable(userMapper.findById(id));
    }

    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return userMapper.existsByEmail(email);
    }

    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return userMapper.existsByUsername(username);
    }

    @Transactional
    public User createUser(User user) {
        Instant now = Instant.now(clock);
        user.setConfirmed(false);
        user.setRefreshToken(null);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException ex) {
            // 并发注册越过了存在性检查，由唯一键兜底
            log.info("Signup lost unique key race, username={}", user.getUsername());
            throw new BusinessException(ErrorCode.ACCOUNT_EXISTS);
        }
        return user;
    }

    /**
     * 替换（或以 null 清空）用户当前唯一有效的刷新令牌。
     */
    @Transactional
    public void updateToken(User user, String refreshToken) {
        Instant now = Instant.now(clock);
        userMapper.updateRefreshToken(user.getId(), refreshToken, now);
        user.setRefreshToken(refreshToken);
        user.setUpdatedAt(now);
    }

    @Transactional
    public void confirmEmail(String email) {
        User user = userMapper.findByEmail(email);
        if (user == null) {
            throw new BusinessException(ErrorCode.VERIFICATION_ERROR);
        }
        userMapper.markConfirmed(user.getId(), Instant.now(clock));
    }

    @Transactional
    public User updateAvatar(long userId, String avatarUrl) {
        User current = userMapper.findById(userId);
        if (current == null) {
            throw new BusinessException(ErrorCode.USER_NOT_FOUND);
        }
        userMapper.updateAvatar(userId, avatarUrl, Instant.now(clock));
        // 更新后回读，保证返回最新头像地址
        return userMapper.findById(userId);
    }
}
