package com.contactbook.auth.password;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 口令单向散列与校验（BCrypt，强度由 `auth.password.bcrypt-strength` 配置）。
 * <p>
 * 存储值格式不合法时仍对占位散列执行一次完整比对，
 * “口令错误”与“格式不识别”两种失败耗时一致。
 */
@Component
public class PasswordHasher {

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;
    private final String placeholderHash;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.placeholderHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String hashValue) {
        if (plaintext == null) {
            return false;
        }
        if (hashValue == null || !BCRYPT_PATTERN.matcher(hashValue).matches()) {
            passwordEncoder.matches(plaintext, placeholderHash);
            return false;
        }
        return passwordEncoder.matches(plaintext, hashValue);
    }
}
