package com.contactbook.user.mapper;

import com.contactbook.user.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface UserMapper {

    User findById(@Param("id") Long id);

    User findByEmail(@Param("email") String email);

    boolean existsByEmail(@Param("email") String email);

    boolean existsByUsername(@Param("username") String username);

    void insert(User user);

    void updateRefreshToken(@Param("id") Long id,
                            @Param("refreshToken") String refreshToken,
                            @Param("updatedAt") Instant updatedAt);

    void markConfirmed(@Param("id") Long id, @Param("updatedAt") Instant updatedAt);

    void updateAvatar(@Param("id") Long id,
                      @Param("avatar") String avatar,
                      @Param("updatedAt") Instant updatedAt);
}
