package com.tasktracker.api.task;

import com.tasktracker.api.ApiClient;
import com.tasktracker.infrastructure.task.TaskRepository;
import com.tasktracker.infrastructure.user.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OwnerCascadeTest {

  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;
  @Autowired UserRepository users;
  @Autowired TaskRepository tasks;

  @Test
  void deletingAUserRemovesOnlyTheirTasks() {
    var api = new ApiClient(rest, port);
    var doomed = api.newAccount("doomed");
    var survivor = api.newAccount("survivor");
    api.createTask(doomed, Map.of("title", "one"));
    api.createTask(doomed, Map.of("title", "two"));
    api.createTask(survivor, Map.of("title", "mine"));

    UUID doomedId = UUID.fromString(doomed.id());
    UUID survivorId = UUID.fromString(survivor.id());
    assertThat(tasks.countByOwnerId(doomedId)).isEqualTo(2);

    users.deleteById(doomedId);

    assertThat(users.findById(doomedId)).isEmpty();
    assertThat(tasks.countByOwnerId(doomedId)).isZero();
    assertThat(tasks.countByOwnerId(survivorId)).isEqualTo(1);
  }
}
