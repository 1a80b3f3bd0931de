package com.tasktracker.api.security;

/**
 * Claim names and values carried by tokens this service issues.
 *
 *  - sub        = internal user UUID
 *  - token_type = access | refresh
 *  - username   = login name at issue time
 *  - role       = USER / ADMIN
 */
public final class TokenClaims {

  public static final String TOKEN_TYPE = "token_type";
  public static final String USERNAME = "username";
  public static final String ROLE = "role";

  public static final String ACCESS = "access";
  public static final String REFRESH = "refresh";

  private TokenClaims() {}
}
