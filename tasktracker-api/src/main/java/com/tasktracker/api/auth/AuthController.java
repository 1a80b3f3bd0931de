package com.tasktracker.api.auth;

import com.tasktracker.api.security.CallerResolver;
import com.tasktracker.infrastructure.user.UserEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private static final String BLANK = "This field may not be blank.";
  private static final String NOT_BLANK_IF_PRESENT = "(?s).*\\S.*";

  private final AuthService auth;
  private final CallerResolver callers;

  public AuthController(AuthService auth, CallerResolver callers) {
    this.auth = auth;
    this.callers = callers;
  }

  public record RegisterRequest(
      @NotBlank(message = BLANK)
      @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
      @Pattern(regexp = "^[\\w.@+-]*$",
          message = "Enter a valid username. This value may contain only letters, numbers, and @/./+/-/_ characters.")
      String username,

      @NotBlank(message = BLANK)
      @Email(message = "Enter a valid email address.")
      @Size(max = 254, message = "Ensure this field has no more than 254 characters.")
      String email,

      @NotBlank(message = BLANK)
      String password,

      @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
      String firstName,

      @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
      String lastName
  ) {}

  /** Writable profile fields. Username, id and join date are read-only. */
  public record ProfileUpdateRequest(
      @Pattern(regexp = NOT_BLANK_IF_PRESENT, message = BLANK)
      @Email(message = "Enter a valid email address.")
      @Size(max = 254, message = "Ensure this field has no more than 254 characters.")
      String email,

      @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
      String firstName,

      @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
      String lastName
  ) {}

  public record PublicUser(UUID id, String username, String email, String firstName, String lastName) {
    static PublicUser of(UserEntity u) {
      return new PublicUser(u.getId(), u.getUsername(), u.getEmail(), u.getFirstName(), u.getLastName());
    }
  }

  public record Profile(
      UUID id,
      String username,
      String email,
      String firstName,
      String lastName,
      Instant dateJoined
  ) {
    static Profile of(UserEntity u) {
      return new Profile(u.getId(), u.getUsername(), u.getEmail(), u.getFirstName(), u.getLastName(), u.getCreatedAt());
    }
  }

  @PostMapping(value = {"/register", "/register/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterRequest req) {
    UserEntity created = auth.register(req);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", "User created successfully");
    body.put("user", PublicUser.of(created));
    return ResponseEntity.status(HttpStatus.CREATED).body(body);
  }

  @GetMapping(value = {"/me", "/me/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Profile me(@AuthenticationPrincipal Jwt jwt) {
    var caller = callers.require(jwt);
    return Profile.of(auth.profile(caller.userId()));
  }

  @PutMapping(value = {"/me", "/me/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Profile updateMe(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody ProfileUpdateRequest req) {
    var caller = callers.require(jwt);
    return Profile.of(auth.updateProfile(caller.userId(), req));
  }
}
