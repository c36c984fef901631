package com.contactbook.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private Long id;
    private String username;
    private String email;
    private String passwordHash;
    private String refreshToken;
    private boolean confirmed;
    private String avatar;
    private Instant createdAt;
    private Instant updatedAt;
}
