package com.tasktracker.api.security;

import com.tasktracker.domain.AuthenticationFailedException;
import com.tasktracker.infrastructure.user.UserEntity;
import com.tasktracker.infrastructure.user.UserRepository;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Turns a verified access token into the stored identity it names.
 *
 * The token proves who signed in; this check makes sure that identity still
 * exists and is enabled. Anything else is reported as an invalid token (401).
 */
@Component
public class CallerResolver {

  private final UserRepository users;

  public CallerResolver(UserRepository users) {
    this.users = users;
  }

  @Transactional(readOnly = true)
  public Caller require(Jwt jwt) {
    if (jwt == null) {
      throw AuthenticationFailedException.invalidToken();
    }
    UUID userId = parseUuidOrNull(jwt.getSubject());
    if (userId == null) {
      throw AuthenticationFailedException.invalidToken();
    }
    UserEntity user = users.findById(userId)
        .filter(UserEntity::isEnabled)
        .orElseThrow(AuthenticationFailedException::invalidToken);
    return new Caller(user.getId(), user.getUsername(), user.getRole());
  }

  private static UUID parseUuidOrNull(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException notUuid) {
      return null;
    }
  }
}
