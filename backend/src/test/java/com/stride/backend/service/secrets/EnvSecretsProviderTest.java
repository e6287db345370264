package com.stride.backend.service.secrets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvSecretsProviderTest {

    private final Map<String, String> env = new HashMap<>();
    private final EnvSecretsProvider provider = new EnvSecretsProvider(env::get);

    @Test
    void directVariableIsTrimmed() {
        env.put("JWT_SECRET", "  s3cret-value \n");

        assertThat(provider.getSecret("JWT_SECRET")).contains("s3cret-value");
    }

    @Test
    void blankVariableCountsAsMissing() {
        env.put("JWT_SECRET", "   ");

        assertThat(provider.getSecret("JWT_SECRET")).isEmpty();
    }

    @Test
    void fileVariableIsReadWhenDirectOneIsUnset(@TempDir Path dir) throws Exception {
        Path keyFile = dir.resolve("data-key");
        Files.writeString(keyFile, "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff\n");
        env.put("DATA_ENCRYPTION_KEY_FILE", keyFile.toString());

        assertThat(provider.getSecret("DATA_ENCRYPTION_KEY"))
                .contains("00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff");
    }

    @Test
    void directVariableWinsOverFile(@TempDir Path dir) throws Exception {
        Path keyFile = dir.resolve("jwt");
        Files.writeString(keyFile, "from-file");
        env.put("JWT_SECRET", "from-env");
        env.put("JWT_SECRET_FILE", keyFile.toString());

        assertThat(provider.getSecret("JWT_SECRET")).contains("from-env");
    }

    @Test
    void unreadableSecretFileFailsLoudly(@TempDir Path dir) {
        env.put("JWT_SECRET_FILE", dir.resolve("missing").toString());

        assertThatThrownBy(() -> provider.getSecret("JWT_SECRET"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("JWT_SECRET");
    }
}
