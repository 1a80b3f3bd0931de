package com.tasktracker.api.auth;

import com.tasktracker.domain.AuthenticationFailedException;
import com.tasktracker.domain.ValidationException;
import com.tasktracker.domain.user.PasswordPolicy;
import com.tasktracker.infrastructure.user.UserEntity;
import com.tasktracker.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Account registration and profile maintenance.
 */
@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  static final String USERNAME_TAKEN = "A user with that username already exists.";

  private final UserRepository users;
  private final PasswordEncoder passwordEncoder;
  private final PasswordPolicy passwordPolicy;

  public AuthService(UserRepository users, PasswordEncoder passwordEncoder, PasswordPolicy passwordPolicy) {
    this.users = users;
    this.passwordEncoder = passwordEncoder;
    this.passwordPolicy = passwordPolicy;
  }

  public UserEntity register(AuthController.RegisterRequest req) {
    String username = req.username().trim();
    String email = normalizeEmail(req.email());

    Map<String, List<String>> errors = new LinkedHashMap<>();
    if (users.existsByUsername(username)) {
      errors.put("username", List.of(USERNAME_TAKEN));
    }
    List<String> weak = passwordPolicy.check(req.password(),
        new PasswordPolicy.UserAttributes(username, req.firstName(), req.lastName(), email));
    if (!weak.isEmpty()) {
      errors.put("password", weak);
    }
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }

    var entity = new UserEntity(
        UUID.randomUUID(),
        username,
        email,
        passwordEncoder.encode(req.password()),
        UserEntity.ROLE_USER,
        Instant.now()
    );
    entity.setFirstName(trimOrEmpty(req.firstName()));
    entity.setLastName(trimOrEmpty(req.lastName()));

    try {
      users.saveAndFlush(entity);
    } catch (DataIntegrityViolationException race) {
      // concurrent registration won the unique constraint
      throw ValidationException.of("username", USERNAME_TAKEN);
    }
    log.info("[AUTH] registered userId={} username={}", entity.getId(), username);
    return entity;
  }

  @Transactional(readOnly = true)
  public UserEntity profile(UUID userId) {
    return users.findById(userId).orElseThrow(AuthenticationFailedException::invalidToken);
  }

  @Transactional
  public UserEntity updateProfile(UUID userId, AuthController.ProfileUpdateRequest req) {
    UserEntity user = users.findById(userId).orElseThrow(AuthenticationFailedException::invalidToken);
    if (req.email() != null) user.setEmail(normalizeEmail(req.email()));
    if (req.firstName() != null) user.setFirstName(req.firstName().trim());
    if (req.lastName() != null) user.setLastName(req.lastName().trim());
    return user;
  }

  /**
   * Creates an account without running the password policy. Used for the
   * configured bootstrap administrator only.
   */
  @Transactional
  public boolean createIfAbsent(String username, String email, String rawPassword, String role) {
    if (users.existsByUsername(username)) {
      return false;
    }
    users.save(new UserEntity(
        UUID.randomUUID(),
        username,
        normalizeEmail(email),
        passwordEncoder.encode(rawPassword),
        role,
        Instant.now()
    ));
    return true;
  }

  // Only the domain part is case-insensitive.
  static String normalizeEmail(String email) {
    if (email == null) return "";
    String e = email.trim();
    int at = e.lastIndexOf('@');
    if (at < 0) return e;
    return e.substring(0, at + 1) + e.substring(at + 1).toLowerCase(Locale.ROOT);
  }

  private static String trimOrEmpty(String s) {
    return s == null ? "" : s.trim();
  }
}
