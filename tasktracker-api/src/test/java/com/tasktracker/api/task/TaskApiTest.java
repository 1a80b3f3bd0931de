package com.tasktracker.api.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.tasktracker.api.ApiClient;
import com.tasktracker.api.ApiClient.Account;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class TaskApiTest {

  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;

  ApiClient api;

  @BeforeEach
  void setUp() {
    api = new ApiClient(rest, port);
  }

  @Test
  void aliceAndBobSeeOnlyTheirOwnTasks() {
    Account alice = api.newAccount("alice");
    Account bob = api.newAccount("bob");

    var created = api.createTask(alice, Map.of("title", "Buy milk"));
    assertThat(created.getStatusCode().value()).isEqualTo(201);
    assertThat(created.getBody().path("status").asText()).isEqualTo("todo");
    assertThat(created.getBody().path("description").asText()).isEmpty();
    assertThat(created.getBody().path("owner").asText()).isEqualTo(alice.id());
    long id = created.getBody().path("id").asLong();

    var bobList = api.get("/api/tasks", bob.access());
    assertThat(bobList.getStatusCode().value()).isEqualTo(200);
    assertThat(bobList.getBody().isArray()).isTrue();
    assertThat(bobList.getBody()).isEmpty();

    assertThat(api.get("/api/tasks/" + id, bob.access()).getStatusCode().value()).isEqualTo(404);

    var aliceList = api.get("/api/tasks", alice.access());
    assertThat(ids(aliceList.getBody())).containsExactly(id);
  }

  @Test
  void ownerInRequestBodyIsIgnored() {
    Account alice = api.newAccount("owner_a");
    Account bob = api.newAccount("owner_b");

    Map<String, Object> body = new HashMap<>();
    body.put("title", "Sneaky");
    body.put("owner", bob.id());
    body.put("user", bob.id());
    body.put("id", 999999);
    body.put("created_at", "2000-01-01T00:00:00Z");

    var created = api.createTask(alice, body);

    assertThat(created.getStatusCode().value()).isEqualTo(201);
    assertThat(created.getBody().path("owner").asText()).isEqualTo(alice.id());
    assertThat(created.getBody().path("id").asLong()).isNotEqualTo(999999L);
    assertThat(Instant.parse(created.getBody().path("created_at").asText()))
        .isAfter(Instant.parse("2020-01-01T00:00:00Z"));
    assertThat(api.get("/api/tasks", bob.access()).getBody()).isEmpty();
  }

  @Test
  void foreignTaskLooksExactlyLikeAMissingOne() {
    Account alice = api.newAccount("iso_a");
    Account bob = api.newAccount("iso_b");
    long id = api.createTask(bob, Map.of("title", "Bob's secret", "description", "private"))
        .getBody().path("id").asLong();

    var foreignGet = api.get("/api/tasks/" + id, alice.access());
    var missingGet = api.get("/api/tasks/" + Long.MAX_VALUE, alice.access());

    assertThat(foreignGet.getStatusCode().value()).isEqualTo(404);
    assertThat(missingGet.getStatusCode().value()).isEqualTo(404);
    assertThat(foreignGet.getBody().path("reason").asText())
        .isEqualTo(missingGet.getBody().path("reason").asText())
        .isEqualTo("not_found");
    assertThat(foreignGet.getBody().path("message").asText())
        .isEqualTo(missingGet.getBody().path("message").asText());
    assertThat(foreignGet.getBody().toString()).doesNotContain("Bob's secret").doesNotContain("private");

    var put = api.put("/api/tasks/" + id, Map.of("title", "hijacked"), alice.access());
    var patch = api.patch("/api/tasks/" + id, Map.of("status", "done"), alice.access());
    var delete = api.delete("/api/tasks/" + id, alice.access());
    assertThat(put.getStatusCode().value()).isEqualTo(404);
    assertThat(patch.getStatusCode().value()).isEqualTo(404);
    assertThat(delete.getStatusCode().value()).isEqualTo(404);

    var untouched = api.get("/api/tasks/" + id, bob.access());
    assertThat(untouched.getStatusCode().value()).isEqualTo(200);
    assertThat(untouched.getBody().path("title").asText()).isEqualTo("Bob's secret");
    assertThat(untouched.getBody().path("status").asText()).isEqualTo("todo");
  }

  @Test
  void createGetUpdateDeleteRoundTrip() {
    Account alice = api.newAccount("round");
    var created = api.createTask(alice, Map.of("title", "Write report", "description", "Q3 numbers"));
    long id = created.getBody().path("id").asLong();
    Instant createdAt = Instant.parse(created.getBody().path("created_at").asText());
    Instant firstUpdate = Instant.parse(created.getBody().path("updated_at").asText());

    var fetched = api.get("/api/tasks/" + id, alice.access());
    assertThat(fetched.getStatusCode().value()).isEqualTo(200);
    assertThat(fetched.getBody().path("title").asText()).isEqualTo("Write report");
    assertThat(fetched.getBody().path("description").asText()).isEqualTo("Q3 numbers");

    var done = api.patch("/api/tasks/" + id, Map.of("status", "done"), alice.access());
    assertThat(done.getStatusCode().value()).isEqualTo(200);
    assertThat(done.getBody().path("status").asText()).isEqualTo("done");
    assertThat(done.getBody().path("title").asText()).isEqualTo("Write report");
    assertThat(Instant.parse(done.getBody().path("updated_at").asText())).isAfter(firstUpdate);
    assertThat(Instant.parse(done.getBody().path("created_at").asText())).isEqualTo(createdAt);

    var deleted = api.delete("/api/tasks/" + id, alice.access());
    assertThat(deleted.getStatusCode().value()).isEqualTo(204);
    assertThat(api.get("/api/tasks/" + id, alice.access()).getStatusCode().value()).isEqualTo(404);
    assertThat(api.delete("/api/tasks/" + id, alice.access()).getStatusCode().value()).isEqualTo(404);
  }

  @Test
  void everyUpdateMovesUpdatedAtForward() {
    Account alice = api.newAccount("bump");
    long id = api.createTask(alice, Map.of("title", "t")).getBody().path("id").asLong();

    Instant previous = Instant.parse(api.get("/api/tasks/" + id, alice.access()).getBody().path("updated_at").asText());
    for (String status : List.of("in_progress", "todo", "done", "done")) {
      var r = api.patch("/api/tasks/" + id, Map.of("status", status), alice.access());
      Instant next = Instant.parse(r.getBody().path("updated_at").asText());
      assertThat(next).isAfter(previous);
      previous = next;
    }
  }

  @Test
  void putReplacesTitleAndKeepsOmittedFields() {
    Account alice = api.newAccount("put");
    long id = api.createTask(alice, Map.of("title", "Old", "description", "keep me", "status", "in_progress"))
        .getBody().path("id").asLong();

    var r = api.put("/api/tasks/" + id, Map.of("title", "New"), alice.access());

    assertThat(r.getStatusCode().value()).isEqualTo(200);
    assertThat(r.getBody().path("title").asText()).isEqualTo("New");
    assertThat(r.getBody().path("description").asText()).isEqualTo("keep me");
    assertThat(r.getBody().path("status").asText()).isEqualTo("in_progress");
  }

  @Test
  void putRequiresTitle() {
    Account alice = api.newAccount("put_req");
    long id = api.createTask(alice, Map.of("title", "Old")).getBody().path("id").asLong();

    var r = api.put("/api/tasks/" + id, Map.of("status", "done"), alice.access());

    assertThat(r.getStatusCode().value()).isEqualTo(400);
    assertThat(r.getBody().path("fields").has("title")).isTrue();
    assertThat(api.get("/api/tasks/" + id, alice.access()).getBody().path("status").asText()).isEqualTo("todo");
  }

  @Test
  void listingIsNewestFirst() {
    Account alice = api.newAccount("order");
    List<Long> created = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      created.add(api.createTask(alice, Map.of("title", "task " + i)).getBody().path("id").asLong());
    }

    var r = api.get("/api/tasks", alice.access());

    assertThat(ids(r.getBody())).containsExactly(created.get(3), created.get(2), created.get(1), created.get(0));
  }

  @Test
  void listingCanBeFilteredByStatus() {
    Account alice = api.newAccount("filter");
    long todo = api.createTask(alice, Map.of("title", "a")).getBody().path("id").asLong();
    long done = api.createTask(alice, Map.of("title", "b", "status", "done")).getBody().path("id").asLong();

    assertThat(ids(api.get("/api/tasks?status=done", alice.access()).getBody())).containsExactly(done);
    assertThat(ids(api.get("/api/tasks?status=todo", alice.access()).getBody())).containsExactly(todo);
    assertThat(api.get("/api/tasks?status=in_progress", alice.access()).getBody()).isEmpty();

    var invalid = api.get("/api/tasks?status=archived", alice.access());
    assertThat(invalid.getStatusCode().value()).isEqualTo(400);
    assertThat(invalid.getBody().path("fields").path("status").get(0).asText())
        .isEqualTo("Select a valid choice. archived is not one of the available choices.");
  }

  @Test
  void createRejectsInvalidInput() {
    Account alice = api.newAccount("invalid");

    var missingTitle = api.createTask(alice, Map.of("description", "no title"));
    assertThat(missingTitle.getStatusCode().value()).isEqualTo(400);
    assertThat(missingTitle.getBody().path("reason").asText()).isEqualTo("validation_error");
    assertThat(missingTitle.getBody().path("fields").has("title")).isTrue();

    var blankTitle = api.createTask(alice, Map.of("title", "   "));
    assertThat(blankTitle.getStatusCode().value()).isEqualTo(400);

    var longTitle = api.createTask(alice, Map.of("title", "x".repeat(201)));
    assertThat(longTitle.getStatusCode().value()).isEqualTo(400);
    assertThat(longTitle.getBody().path("fields").path("title").get(0).asText())
        .isEqualTo("Ensure this field has no more than 200 characters.");

    var badStatus = api.createTask(alice, Map.of("title", "ok", "status", "archived"));
    assertThat(badStatus.getStatusCode().value()).isEqualTo(400);
    assertThat(badStatus.getBody().path("fields").path("status").get(0).asText())
        .isEqualTo("\"archived\" is not a valid choice.");

    assertThat(api.get("/api/tasks", alice.access()).getBody()).isEmpty();
  }

  @Test
  void titleOfExactlyTwoHundredCharactersIsAccepted() {
    Account alice = api.newAccount("edge");

    var r = api.createTask(alice, Map.of("title", "y".repeat(200)));

    assertThat(r.getStatusCode().value()).isEqualTo(201);
  }

  @Test
  void patchRejectsBlankTitleAndUnknownStatus() {
    Account alice = api.newAccount("patch_bad");
    long id = api.createTask(alice, Map.of("title", "Keep")).getBody().path("id").asLong();

    assertThat(api.patch("/api/tasks/" + id, Map.of("title", ""), alice.access()).getStatusCode().value())
        .isEqualTo(400);
    assertThat(api.patch("/api/tasks/" + id, Map.of("status", "DONE"), alice.access()).getStatusCode().value())
        .isEqualTo(400);
    assertThat(api.get("/api/tasks/" + id, alice.access()).getBody().path("title").asText()).isEqualTo("Keep");
  }

  @Test
  void explicitNullIsRejectedWhileOmissionKeepsTheValue() {
    Account alice = api.newAccount("nulls");
    long id = api.createTask(alice, Map.of("title", "Keep", "description", "notes")).getBody().path("id").asLong();

    Map<String, Object> nullDescription = new HashMap<>();
    nullDescription.put("description", null);
    var patched = api.patch("/api/tasks/" + id, nullDescription, alice.access());
    assertThat(patched.getStatusCode().value()).isEqualTo(400);
    assertThat(patched.getBody().path("fields").path("description").get(0).asText())
        .isEqualTo("This field may not be null.");

    Map<String, Object> nullStatus = new HashMap<>();
    nullStatus.put("title", "Renamed");
    nullStatus.put("status", null);
    var replaced = api.put("/api/tasks/" + id, nullStatus, alice.access());
    assertThat(replaced.getStatusCode().value()).isEqualTo(400);
    assertThat(replaced.getBody().path("fields").has("status")).isTrue();

    Map<String, Object> nullTitle = new HashMap<>();
    nullTitle.put("title", null);
    var created = api.createTask(alice, nullTitle);
    assertThat(created.getStatusCode().value()).isEqualTo(400);
    assertThat(created.getBody().path("fields").path("title").get(0).asText())
        .isEqualTo("This field may not be null.");

    var stored = api.get("/api/tasks/" + id, alice.access()).getBody();
    assertThat(stored.path("title").asText()).isEqualTo("Keep");
    assertThat(stored.path("description").asText()).isEqualTo("notes");

    var omitted = api.patch("/api/tasks/" + id, Map.of("status", "done"), alice.access());
    assertThat(omitted.getStatusCode().value()).isEqualTo(200);
    assertThat(omitted.getBody().path("description").asText()).isEqualTo("notes");
  }

  @Test
  void trailingSlashRoutesServeTheSameResources() {
    Account alice = api.newAccount("slash_tasks");

    var created = api.post("/api/tasks/", Map.of("title", "With slash"), alice.access());
    assertThat(created.getStatusCode().value()).isEqualTo(201);
    long id = created.getBody().path("id").asLong();

    assertThat(ids(api.get("/api/tasks/", alice.access()).getBody())).containsExactly(id);
    assertThat(api.get("/api/tasks/" + id + "/", alice.access()).getBody().path("title").asText())
        .isEqualTo("With slash");
    assertThat(api.patch("/api/tasks/" + id + "/", Map.of("status", "done"), alice.access())
        .getBody().path("status").asText()).isEqualTo("done");
    assertThat(api.put("/api/tasks/" + id + "/", Map.of("title", "Renamed"), alice.access())
        .getBody().path("title").asText()).isEqualTo("Renamed");
    assertThat(api.delete("/api/tasks/" + id + "/", alice.access()).getStatusCode().value()).isEqualTo(204);
    assertThat(api.get("/api/tasks/" + id + "/", alice.access()).getStatusCode().value()).isEqualTo(404);

    assertThat(api.get("/api/tasks/", null).getStatusCode().value()).isEqualTo(401);
  }

  @Test
  void malformedJsonIsABadRequest() {
    Account alice = api.newAccount("malformed");

    var r = api.post("/api/tasks", "{\"title\": ", alice.access());

    assertThat(r.getStatusCode().value()).isEqualTo(400);
    assertThat(r.getBody().path("reason").asText()).isEqualTo("bad_request");
  }

  @Test
  void nonNumericIdIsNotFound() {
    Account alice = api.newAccount("nan");

    assertThat(api.get("/api/tasks/abc", alice.access()).getStatusCode().value()).isEqualTo(404);
  }

  @Test
  void anonymousRequestsAreRejected() {
    assertThat(api.get("/api/tasks", null).getStatusCode().value()).isEqualTo(401);
    assertThat(api.post("/api/tasks", Map.of("title", "x"), null).getStatusCode().value()).isEqualTo(401);
    assertThat(api.get("/api/tasks/1", "not.a.jwt").getStatusCode().value()).isEqualTo(401);
  }

  @Test
  void uuidShapedIdIsNotFound() {
    Account alice = api.newAccount("uuid_id");
    var r = api.get("/api/tasks/" + UUID.randomUUID(), alice.access());

    assertThat(r.getStatusCode().value()).isEqualTo(404);
  }

  private static List<Long> ids(JsonNode array) {
    List<Long> ids = new ArrayList<>();
    array.forEach(n -> ids.add(n.path("id").asLong()));
    return ids;
  }
}
