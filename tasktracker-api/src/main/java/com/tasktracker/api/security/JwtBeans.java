package com.tasktracker.api.security;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.JWSAlgorithm;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;

/**
 * Signing and verification for the HS256 tokens.
 *
 * Two decoders share the key but differ in the token_type they accept, so a
 * refresh token is never accepted as a bearer credential and vice versa.
 * Expiry is checked with zero clock skew.
 */
@Configuration
public class JwtBeans {

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public JwtEncoder jwtEncoder(@Value("${tasktracker.auth.jwt-secret:}") String secret) {
    byte[] keyBytes = normalizeSecret(secret);
    var jwk = new OctetSequenceKey.Builder(keyBytes)
        .algorithm(JWSAlgorithm.HS256)
        .keyID("tasktracker-hs256")
        .build();

    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  @Bean
  @Primary
  public JwtDecoder accessTokenDecoder(
      @Value("${tasktracker.auth.jwt-secret:}") String secret,
      @Value("${tasktracker.auth.issuer}") String issuer
  ) {
    return decoder(secret, issuer, TokenClaims.ACCESS);
  }

  @Bean
  public JwtDecoder refreshTokenDecoder(
      @Value("${tasktracker.auth.jwt-secret:}") String secret,
      @Value("${tasktracker.auth.issuer}") String issuer
  ) {
    return decoder(secret, issuer, TokenClaims.REFRESH);
  }

  private JwtDecoder decoder(String secret, String issuer, String tokenType) {
    var key = new SecretKeySpec(normalizeSecret(secret), "HmacSHA256");
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();

    OAuth2TokenValidator<Jwt> validator = new DelegatingOAuth2TokenValidator<>(
        new JwtTimestampValidator(Duration.ZERO),
        new JwtIssuerValidator(issuer),
        new JwtClaimValidator<Object>(TokenClaims.TOKEN_TYPE, tokenType::equals)
    );
    decoder.setJwtValidator(validator);
    return decoder;
  }

  /**
   * Accepts any configured secret string and derives a fixed 32-byte key (HS256 friendly).
   * An empty secret is only tolerated under the "dev" profile.
   */
  private byte[] normalizeSecret(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev"))) {
        s = "dev-secret-change-me";
      } else {
        throw new IllegalStateException("tasktracker.auth.jwt-secret is empty. Set TASKTRACKER_JWT_SECRET.");
      }
    }

    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
