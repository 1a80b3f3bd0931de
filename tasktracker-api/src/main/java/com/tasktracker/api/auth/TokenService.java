package com.tasktracker.api.auth;

import com.tasktracker.api.security.TokenClaims;
import com.tasktracker.domain.AuthenticationFailedException;
import com.tasktracker.infrastructure.user.UserEntity;
import com.tasktracker.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Issues and refreshes signed tokens.
 *
 * Both tokens are self-contained HS256 JWTs; nothing is stored server side.
 * The refresh token only ever yields a new access token.
 */
@Service
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final UserRepository users;
  private final PasswordEncoder passwordEncoder;
  private final JwtEncoder jwtEncoder;
  private final JwtDecoder refreshTokenDecoder;

  private final String issuer;
  private final long accessTokenMinutes;
  private final long refreshTokenDays;

  // compared against when the username is unknown, so both failure paths cost one hash check
  private final String dummyHash;

  public TokenService(
      UserRepository users,
      PasswordEncoder passwordEncoder,
      JwtEncoder jwtEncoder,
      @Qualifier("refreshTokenDecoder") JwtDecoder refreshTokenDecoder,
      @Value("${tasktracker.auth.issuer}") String issuer,
      @Value("${tasktracker.auth.access-token-minutes}") long accessTokenMinutes,
      @Value("${tasktracker.auth.refresh-token-days}") long refreshTokenDays
  ) {
    this.users = users;
    this.passwordEncoder = passwordEncoder;
    this.jwtEncoder = jwtEncoder;
    this.refreshTokenDecoder = refreshTokenDecoder;
    this.issuer = issuer;
    this.accessTokenMinutes = accessTokenMinutes;
    this.refreshTokenDays = refreshTokenDays;
    this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  @Transactional(readOnly = true)
  public TokenPair obtain(String username, String password) {
    var user = users.findByUsername(username == null ? "" : username).orElse(null);
    String hash = user == null ? dummyHash : user.getPasswordHash();
    boolean matches = passwordEncoder.matches(password == null ? "" : password, hash);

    if (user == null || !matches || !user.isEnabled()) {
      log.info("[AUTH] token request rejected username={}", username);
      throw AuthenticationFailedException.badCredentials();
    }

    Instant now = Instant.now();
    return new TokenPair(
        encode(user, TokenClaims.ACCESS, now, now.plus(accessTokenMinutes, ChronoUnit.MINUTES)),
        encode(user, TokenClaims.REFRESH, now, now.plus(refreshTokenDays, ChronoUnit.DAYS))
    );
  }

  @Transactional(readOnly = true)
  public String refresh(String refreshToken) {
    Jwt jwt;
    try {
      jwt = refreshTokenDecoder.decode(refreshToken);
    } catch (JwtException e) {
      log.info("[AUTH] refresh rejected: {}", e.getMessage());
      throw AuthenticationFailedException.invalidToken();
    }

    if (jwt.getSubject() == null) {
      throw AuthenticationFailedException.invalidToken();
    }
    UUID userId;
    try {
      userId = UUID.fromString(jwt.getSubject());
    } catch (IllegalArgumentException e) {
      throw AuthenticationFailedException.invalidToken();
    }

    var user = users.findById(userId)
        .filter(UserEntity::isEnabled)
        .orElseThrow(AuthenticationFailedException::invalidToken);

    Instant now = Instant.now();
    return encode(user, TokenClaims.ACCESS, now, now.plus(accessTokenMinutes, ChronoUnit.MINUTES));
  }

  private String encode(UserEntity user, String tokenType, Instant issuedAt, Instant expiresAt) {
    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .issuedAt(issuedAt)
        .expiresAt(expiresAt)
        .id(UUID.randomUUID().toString())
        .subject(user.getId().toString())
        .claim(TokenClaims.TOKEN_TYPE, tokenType)
        .claim(TokenClaims.USERNAME, user.getUsername())
        .claim(TokenClaims.ROLE, user.getRole())
        .build();

    // Pin HS256 on the header so the encoder selects the octet key.
    try {
      return jwtEncoder.encode(
          JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
      ).getTokenValue();
    } catch (JwtEncodingException e) {
      log.error("JWT encode failed (check tasktracker.auth.jwt-secret / issuer config)", e);
      throw e;
    }
  }

  public record TokenPair(String access, String refresh) {}
}
