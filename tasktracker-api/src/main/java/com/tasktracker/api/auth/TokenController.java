package com.tasktracker.api.auth;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/token")
public class TokenController {

  private final TokenService tokens;

  public TokenController(TokenService tokens) {
    this.tokens = tokens;
  }

  public record TokenRequest(
      @NotBlank(message = "This field may not be blank.") String username,
      @NotBlank(message = "This field may not be blank.") String password
  ) {}

  public record RefreshRequest(
      @NotBlank(message = "This field may not be blank.") String refresh
  ) {}

  @PostMapping(value = {"", "/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TokenService.TokenPair> obtain(@Valid @RequestBody TokenRequest req) {
    return ResponseEntity.ok(tokens.obtain(req.username(), req.password()));
  }

  @PostMapping(value = {"/refresh", "/refresh/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, String>> refresh(@Valid @RequestBody RefreshRequest req) {
    return ResponseEntity.ok(Map.of("access", tokens.refresh(req.refresh())));
  }
}
