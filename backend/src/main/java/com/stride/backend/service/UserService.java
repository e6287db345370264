package com.stride.backend.service;

import com.stride.backend.exception.ConflictException;
import com.stride.backend.exception.UnauthorizedException;
import com.stride.backend.model.User;
import com.stride.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional
    public User register(String email, String password) {
        String emailHash = hashEmail(email);
        if (userRepository.existsByEmailHash(emailHash)) {
            throw new ConflictException("An account with this email already exists");
        }
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .email(normalize(email))
                .emailHash(emailHash)
                .passwordHash(passwordEncoder.encode(password))
                .createdAt(clock.instant())
                .build();
        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // a concurrent registration took the email between the check and the insert
            log.info("Registration lost a race on an existing email hash");
            throw new ConflictException("An account with this email already exists");
        }
        log.info("Registered user id={}", saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public User authenticate(String email, String password) {
        User user = userRepository.findByEmailHash(hashEmail(email))
                .orElseThrow(() -> new UnauthorizedException("Invalid credentials"));
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new UnauthorizedException("Invalid credentials");
        }
        return user;
    }

    @Transactional(readOnly = true)
    public Optional<User> findById(String id) {
        return userRepository.findById(id);
    }

    static String hashEmail(String email) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalize(email).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
