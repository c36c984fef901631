package com.contactbook.auth.token;

import com.contactbook.auth.config.AuthProperties;
import com.contactbook.common.exception.InvalidTokenException;
import com.contactbook.user.domain.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JWT 令牌服务。
 * <p>
 * 功能：签发 Access/Refresh Token 与邮箱确认令牌（HS256），解码并校验令牌类型。
 * 声明：
 * - `token_type`：access、refresh 或 email，三者互不通用；
 * - `uid`：用户 ID（access/refresh），邮箱确认令牌的 subject 为邮箱；
 * - `jti`：令牌 ID，保证同一秒内签发的令牌也互不相同。
 * 过期时间：来自 `AuthProperties.jwt` 的三个 TTL。
 * 所有解码失败统一抛出 {@link InvalidTokenException}，不区分签名、过期或类型错误。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JwtService {

    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_USER_ID = "uid";

    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";
    static final String TYPE_EMAIL = "email";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final AuthProperties properties;
    private final Clock clock;

    public TokenPair issueTokenPair(User user) {
        Instant issuedAt = Instant.now(clock);
        Instant accessExpiresAt = issuedAt.plus(properties.getJwt().getAccessTokenTtl());
        Instant refreshExpiresAt = issuedAt.plus(properties.getJwt().getRefreshTokenTtl());
        String accessToken = encodeUserToken(user, issuedAt, accessExpiresAt, TYPE_ACCESS);
        String refreshToken = encodeUserToken(user, issuedAt, refreshExpiresAt, TYPE_REFRESH);
        return new TokenPair(accessToken, accessExpiresAt, refreshToken, refreshExpiresAt);
    }

    public String createAccessToken(User user) {
        Instant issuedAt = Instant.now(clock);
        return encodeUserToken(user, issuedAt, issuedAt.plus(properties.getJwt().getAccessTokenTtl()), TYPE_ACCESS);
    }

    public String createRefreshToken(User user) {
        Instant issuedAt = Instant.now(clock);
        return encodeUserToken(user, issuedAt, issuedAt.plus(properties.getJwt().getRefreshTokenTtl()), TYPE_REFRESH);
    }

    public String createEmailToken(String email) {
        Instant issuedAt = Instant.now(clock);
        Duration ttl = properties.getJwt().getEmailTokenTtl();
        JwtClaimsSet claims = baseClaims(issuedAt, issuedAt.plus(ttl), TYPE_EMAIL)
                .subject(email)
                .build();
        return encode(claims);
    }

    /**
     * @return 访问令牌中的用户 ID
     */
    public long decodeAccessToken(String token) {
        return requireAccessToken(decode(token));
    }

    /**
     * @return 刷新令牌中的用户 ID
     */
    public long decodeRefreshToken(String token) {
        Jwt jwt = decode(token);
        requireType(jwt, TYPE_REFRESH);
        return extractUserId(jwt);
    }

    /**
     * @return 确认令牌中的邮箱
     */
    public String decodeEmailToken(String token) {
        Jwt jwt = decode(token);
        requireType(jwt, TYPE_EMAIL);
        String email = jwt.getSubject();
        if (email == null || email.isBlank()) {
            throw new InvalidTokenException();
        }
        return email;
    }

    /**
     * 资源服务器已完成签名与有效期校验的 {@link Jwt}，此处只确认类型并取出用户 ID。
     */
    public long requireAccessToken(Jwt jwt) {
        requireType(jwt, TYPE_ACCESS);
        return extractUserId(jwt);
    }

    public Jwt decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException();
        }
        try {
            return jwtDecoder.decode(token);
        } catch (JwtException ex) {
            log.debug("Token rejected: {}", ex.getMessage());
            throw new InvalidTokenException(ex);
        }
    }

    public long extractUserId(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_USER_ID);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ex) {
                throw new InvalidTokenException(ex);
            }
        }
        throw new InvalidTokenException();
    }

    public String extractTokenType(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_TOKEN_TYPE);
        return claim != null ? claim.toString() : "";
    }

    private void requireType(Jwt jwt, String expected) {
        if (!Objects.equals(expected, extractTokenType(jwt))) {
            log.debug("Token type mismatch, expected {}", expected);
            throw new InvalidTokenException();
        }
    }

    private String encodeUserToken(User user, Instant issuedAt, Instant expiresAt, String tokenType) {
        JwtClaimsSet claims = baseClaims(issuedAt, expiresAt, tokenType)
                .subject(String.valueOf(user.getId()))
                .claim(CLAIM_USER_ID, user.getId())
                .build();
        return encode(claims);
    }

    private JwtClaimsSet.Builder baseClaims(Instant issuedAt, Instant expiresAt, String tokenType) {
        return JwtClaimsSet.builder()
                .issuer(properties.getJwt().getIssuer())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_TOKEN_TYPE, tokenType);
    }

    private String encode(JwtClaimsSet claims) {
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }
}
