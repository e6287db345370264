package com.stride.backend.service.secrets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Reads secrets from the process environment. When {@code KEY} is unset,
 * {@code KEY_FILE} may name a file holding the value, as mounted container
 * secrets do.
 */
@Slf4j
@Component
public class EnvSecretsProvider implements SecretsProvider {

    static final String FILE_SUFFIX = "_FILE";

    private final UnaryOperator<String> environment;

    @Autowired
    public EnvSecretsProvider() {
        this(System::getenv);
    }

    EnvSecretsProvider(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> getSecret(String key) {
        Optional<String> direct = nonBlank(environment.apply(key));
        if (direct.isPresent()) {
            return direct;
        }
        return nonBlank(environment.apply(key + FILE_SUFFIX)).flatMap(path -> readFile(key, path));
    }

    @Override
    public String name() {
        return "environment";
    }

    private static Optional<String> readFile(String key, String path) {
        try {
            return nonBlank(Files.readString(Path.of(path), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Cannot read {}{} from {}", key, FILE_SUFFIX, path);
            throw new UncheckedIOException("Secret file for " + key + " is not readable", e);
        }
    }

    private static Optional<String> nonBlank(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
