package com.contactbook.support;

import com.contactbook.user.domain.User;
import com.contactbook.user.mapper.UserMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版 UserMapper，读写都复制对象，行为接近真实数据库。
 */
public class InMemoryUserMapper implements UserMapper {

    private final Map<Long, User> rows = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public User findById(Long id) {
        return copy(rows.get(id));
    }

    @Override
    public User findByEmail(String email) {
        return rows.values().stream()
                .filter(user -> user.getEmail().equals(email))
                .findFirst()
                .map(InMemoryUserMapper::copy)
                .orElse(null);
    }

    @Override
    public boolean existsByEmail(String email) {
        return rows.values().stream().anyMatch(user -> user.getEmail().equals(email));
    }

    @Override
    public boolean existsByUsername(String username) {
        return rows.values().stream().anyMatch(user -> user.getUsername().equals(username));
    }

    @Override
    public void insert(User user) {
        user.setId(sequence.incrementAndGet());
        rows.put(user.getId(), copy(user));
    }

    @Override
    public void updateRefreshToken(Long id, String refreshToken, Instant updatedAt) {
        User row = rows.get(id);
        if (row != null) {
            row.setRefreshToken(refreshToken);
            row.setUpdatedAt(updatedAt);
        }
    }

    @Override
    public void markConfirmed(Long id, Instant updatedAt) {
        User row = rows.get(id);
        if (row != null) {
            row.setConfirmed(true);
            row.setUpdatedAt(updatedAt);
        }
    }

    @Override
    public void updateAvatar(Long id, String avatar, Instant updatedAt) {
        User row = rows.get(id);
        if (row != null) {
            row.setAvatar(avatar);
            row.setUpdatedAt(updatedAt);
        }
    }

    public void delete(Long id) {
        rows.remove(id);
    }

    private static User copy(User user) {
        if (user == null) {
            return null;
        }
        return new User(user.getId(), user.getUsername(), user.getEmail(), user.getPasswordHash(),
                user.getRefreshToken(), user.isConfirmed(), user.getAvatar(), user.getCreatedAt(), user.getUpdatedAt());
    }
}
