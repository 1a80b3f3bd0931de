package com.tasktracker.api.auth;

import com.tasktracker.infrastructure.user.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class BootstrapAdminInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(BootstrapAdminInitializer.class);

  private final BootstrapAdminProperties props;
  private final AuthService auth;

  public BootstrapAdminInitializer(BootstrapAdminProperties props, AuthService auth) {
    this.props = props;
    this.auth = auth;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!props.enabled()) {
      return;
    }
    if (isBlank(props.username()) || isBlank(props.password())) {
      throw new IllegalStateException(
          "tasktracker.bootstrap-admin is enabled but username/password are not set (ADMIN_USERNAME / ADMIN_PASSWORD)");
    }

    boolean created = auth.createIfAbsent(props.username().trim(), props.email(), props.password(), UserEntity.ROLE_ADMIN);
    if (created) {
      log.info("[BOOTSTRAP] admin account created username={}", props.username());
    } else {
      log.info("[BOOTSTRAP] admin account already exists username={}", props.username());
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
