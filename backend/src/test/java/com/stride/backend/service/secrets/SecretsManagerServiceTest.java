package com.stride.backend.service.secrets;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SecretsManagerServiceTest {

    private final Map<String, String> env = new HashMap<>();
    private final MockEnvironment environment = new MockEnvironment();
    private final SecretsManagerService secrets =
            new SecretsManagerService(List.of(new EnvSecretsProvider(env::get)), environment);

    @Test
    void providerValueWinsOverProperty() {
        env.put("JWT_SECRET", "from-env");
        environment.setProperty("stride.security.jwt.secret", "from-properties");

        assertThat(secrets.resolve("JWT_SECRET", "stride.security.jwt.secret")).contains("from-env");
    }

    @Test
    void propertyIsUsedWhenNoProviderHasTheKey() {
        environment.setProperty("stride.security.jwt.secret", " from-properties ");

        assertThat(secrets.resolve("JWT_SECRET", "stride.security.jwt.secret")).contains("from-properties");
        assertThat(secrets.resolve("UNKNOWN_KEY")).isEmpty();
    }

    @Test
    void productionIsDetectedFromActiveProfiles() {
        assertThat(secrets.isProduction()).isFalse();

        environment.setActiveProfiles("prod");

        assertThat(secrets.isProduction()).isTrue();
    }
}
