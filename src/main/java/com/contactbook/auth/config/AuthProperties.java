package com.contactbook.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private final Jwt jwt = new Jwt();
    private final Password password = new Password();
    private final Confirmation confirmation = new Confirmation();
    private final Cors cors = new Cors();

    @Data
    public static class Jwt {
        private String issuer = "contact-book";
        /**
         * HS256 签名密钥，至少 32 字节。
         */
        private String secret;
        private Duration accessTokenTtl = Duration.ofMinutes(15);
        private Duration refreshTokenTtl = Duration.ofDays(7);
        private Duration emailTokenTtl = Duration.ofDays(7);
    }

    @Data
    public static class Password {
        private int bcryptStrength = 12;
    }

    @Data
    public static class Confirmation {
        private String path = "/api/auth/confirmed_email/";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
