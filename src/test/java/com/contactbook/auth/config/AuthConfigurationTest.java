package com.contactbook.auth.config;

import com.contactbook.support.AuthFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthConfigurationTest {

    @Test
    void rejectsMissingOrShortSecret() {
        AuthProperties properties = AuthFixtures.properties();

        properties.getJwt().setSecret(null);
        assertThatThrownBy(() -> new AuthConfiguration(properties).jwtEncoder())
                .isInstanceOf(IllegalStateException.class);

        properties.getJwt().setSecret("too-short");
        assertThatThrownBy(() -> new AuthConfiguration(properties).jwtDecoder())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void defaultsMatchDocumentedValues() {
        AuthProperties properties = new AuthProperties();

        assertThat(properties.getJwt().getAccessTokenTtl()).hasMinutes(15);
        assertThat(properties.getJwt().getRefreshTokenTtl()).hasDays(7);
        assertThat(properties.getJwt().getEmailTokenTtl()).hasDays(7);
        assertThat(properties.getPassword().getBcryptStrength()).isEqualTo(12);
        assertThat(properties.getCors().getAllowedOrigins()).containsExactly("http://localhost:3000");
    }
}
