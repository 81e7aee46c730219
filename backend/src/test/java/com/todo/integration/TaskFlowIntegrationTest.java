package com.todo.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-End Integration Test for task, project and tag management.
 *
 * Covers filtering against a real PostgreSQL schema, navigation counts,
 * the effect of a project delete on its tasks and tenant isolation between
 * two accounts.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Task Flow Integration Tests")
class TaskFlowIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("todo_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    @SuppressWarnings("rawtypes")
    static GenericContainer redisContainer = new GenericContainer("redis:7-alpine")
            .withExposedPorts(6379);

    @Container
    static RabbitMQContainer rabbitContainer = new RabbitMQContainer("rabbitmq:3.13-management-alpine");

    @MockBean
    private JavaMailSender mailSender;

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private String baseUrl;
    private String token;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgresContainer::getJdbcUrl);
        registry.add("spring.datasource.username", postgresContainer::getUsername);
        registry.add("spring.datasource.password", postgresContainer::getPassword);
        registry.add("spring.data.redis.host", redisContainer::getHost);
        registry.add("spring.data.redis.port", () -> redisContainer.getMappedPort(6379));
        registry.add("spring.rabbitmq.host", rabbitContainer::getHost);
        registry.add("spring.rabbitmq.port", rabbitContainer::getAmqpPort);
        registry.add("spring.rabbitmq.username", rabbitContainer::getAdminUsername);
        registry.add("spring.rabbitmq.password", rabbitContainer::getAdminPassword);
    }

    @BeforeEach
    void setUp() throws Exception {
        baseUrl = "http://localhost:" + port;
        token = register();
    }

    @Test
    @DisplayName("Project → tasks → filter → complete → counts")
    void testTaskLifecycle() throws Exception {
        // Step 1: A project with two tasks and one inbox task
        String projectId = data(send(HttpMethod.POST, "/api/projects", Map.of("name", "Work"), token)).path("id").asText();
        String tagId = data(send(HttpMethod.POST, "/api/tags", Map.of("name", "urgent"), token)).path("id").asText();

        String reportId = createTask(Map.of("title", "Write report", "priority", "high",
                "project_id", projectId, "tag_ids", List.of(tagId)));
        createTask(Map.of("title", "Book flights", "project_id", projectId));
        createTask(Map.of("title", "Call mom", "due_date", LocalDate.now().atTime(18, 0).toString()));

        // Step 2: Filter by project and by tag
        JsonNode byProject = body(send(HttpMethod.GET, "/api/tasks?project_id=" + projectId, null, token));
        assertEquals(2, byProject.path("meta").path("total").asInt());

        JsonNode byTag = body(send(HttpMethod.GET, "/api/tasks?tag_id=" + tagId, null, token));
        assertEquals(1, byTag.path("data").size());
        assertEquals("Write report", byTag.path("data").get(0).path("title").asText());

        JsonNode inbox = body(send(HttpMethod.GET, "/api/tasks?project_id=null", null, token));
        assertEquals(1, inbox.path("meta").path("total").asInt());

        // Step 3: Complete a task
        JsonNode completed = data(send(HttpMethod.PATCH, "/api/tasks/" + reportId + "/complete", null, token));
        assertTrue(completed.path("is_completed").asBoolean());
        assertFalse(completed.path("completed_at").isNull());

        // Step 4: Sidebar counts follow
        JsonNode counts = body(send(HttpMethod.GET, "/api/navigation/counts", null, token)).path("counts");
        assertEquals(3, counts.path("all_tasks").asInt());
        assertEquals(1, counts.path("completed").asInt());
        assertEquals(1, counts.path("inbox").asInt());
        assertEquals(1, counts.path("today").asInt());
    }

    @Test
    @DisplayName("Deleting a project should move its tasks to the inbox")
    void testProjectDeleteKeepsTasks() throws Exception {
        String parentId = data(send(HttpMethod.POST, "/api/projects", Map.of("name", "Garden"), token)).path("id").asText();
        String childId = data(send(HttpMethod.POST, "/api/projects",
                Map.of("name", "Bulbs", "parent_id", parentId), token)).path("id").asText();
        String taskId = createTask(Map.of("title", "Plant tulips", "project_id", childId));

        assertEquals(HttpStatus.OK, send(HttpMethod.DELETE, "/api/projects/" + parentId, null, token).getStatusCode());

        assertEquals(HttpStatus.NOT_FOUND, send(HttpMethod.GET, "/api/projects/" + childId, null, token).getStatusCode());
        JsonNode task = data(send(HttpMethod.GET, "/api/tasks/" + taskId, null, token));
        assertTrue(task.path("project_id").isMissingNode() || task.path("project_id").isNull());
    }

    @Test
    @DisplayName("Another account should be denied access to a task")
    void testTenantIsolation() throws Exception {
        String taskId = createTask(Map.of("title", "Private"));
        String intruder = register();

        assertEquals(HttpStatus.FORBIDDEN, send(HttpMethod.GET, "/api/tasks/" + taskId, null, intruder).getStatusCode());
        assertEquals(HttpStatus.FORBIDDEN, send(HttpMethod.DELETE, "/api/tasks/" + taskId, null, intruder).getStatusCode());

        JsonNode list = body(send(HttpMethod.GET, "/api/tasks", null, intruder));
        assertEquals(0, list.path("meta").path("total").asInt());
    }

    @Test
    @DisplayName("A task without a title should fail with a 422 field error")
    void testValidation() throws Exception {
        ResponseEntity<String> response = send(HttpMethod.POST, "/api/tasks", Map.of("priority", "high"), token);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertTrue(body(response).path("errors").has("title"));
    }

    @Test
    @DisplayName("A Persian request should get Persian validation messages")
    void testPersianValidation() throws Exception {
        HttpHeaders headers = jsonHeaders(token);
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "fa-IR,fa;q=0.9,en;q=0.5");

        ResponseEntity<String> response = restTemplate.exchange(baseUrl + "/api/tasks", HttpMethod.POST,
                new HttpEntity<>(Map.of("priority", "high"), headers), String.class);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("fa", response.getHeaders().getFirst("X-Locale"));
        assertEquals("فیلد عنوان الزامی است.", body(response).path("errors").path("title").get(0).asText());
    }

    @Test
    @DisplayName("A date-only due date should be stored as the start of that day")
    void testDateOnlyDueDate() throws Exception {
        String taskId = createTask(Map.of("title", "Pay rent", "due_date", "2030-03-01"));

        JsonNode task = data(send(HttpMethod.GET, "/api/tasks/" + taskId, null, token));
        assertTrue(task.path("due_date").asText().startsWith("2030-03-01T00:00"));
    }

    @Test
    @DisplayName("Malformed query parameters should fail with 422 field errors")
    void testQueryParameterValidation() throws Exception {
        JsonNode notANumber = body(send(HttpMethod.GET, "/api/tasks/search/quick?q=rep&limit=abc", null, token));
        assertEquals(422, notANumber.path("status").asInt());
        assertTrue(notANumber.path("errors").has("limit"));

        JsonNode outOfRange = body(send(HttpMethod.GET, "/api/tasks/search/quick?q=rep&limit=50", null, token));
        assertEquals(422, outOfRange.path("status").asInt());
        assertTrue(outOfRange.path("errors").has("limit"));

        JsonNode outOfRangeList = body(send(HttpMethod.GET, "/api/tasks?per_page=500&sort_order=sideways", null, token));
        assertEquals(422, outOfRangeList.path("status").asInt());
        assertTrue(outOfRangeList.path("errors").has("per_page"));
        assertTrue(outOfRangeList.path("errors").has("sort_order"));

        JsonNode badDay = body(send(HttpMethod.GET, "/api/tasks?due_date_from=soon", null, token));
        assertEquals(422, badDay.path("status").asInt());
        assertEquals("The due date from is not a valid date.", badDay.path("errors").path("due_date_from").get(0).asText());
    }

    @Test
    @DisplayName("Unknown endpoints, wrong methods and non-JSON bodies should map to 404, 405 and 415")
    void testProtocolErrors() throws Exception {
        assertEquals(HttpStatus.NOT_FOUND, send(HttpMethod.GET, "/api/nothing-here", null, token).getStatusCode());
        assertEquals(HttpStatus.METHOD_NOT_ALLOWED, send(HttpMethod.PUT, "/api/tasks", Map.of(), token).getStatusCode());

        HttpHeaders headers = jsonHeaders(token);
        headers.setContentType(MediaType.TEXT_PLAIN);
        ResponseEntity<String> textBody = restTemplate.exchange(baseUrl + "/api/tasks", HttpMethod.POST,
                new HttpEntity<>("title=Write report", headers), String.class);
        assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE, textBody.getStatusCode());
    }

    private String register() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Jane Doe");
        body.put("email", "user-" + UUID.randomUUID() + "@example.com");
        body.put("password", "secret123");
        body.put("password_confirmation", "secret123");
        ResponseEntity<String> response = send(HttpMethod.POST, "/api/auth/register", body, null);
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        return data(response).path("token").asText();
    }

    private String createTask(Map<String, Object> task) throws Exception {
        ResponseEntity<String> response = send(HttpMethod.POST, "/api/tasks", task, token);
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        return data(response).path("id").asText();
    }

    private ResponseEntity<String> send(HttpMethod method, String path, Object body, String bearer) {
        return restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(body, jsonHeaders(bearer)), String.class);
    }

    private HttpHeaders jsonHeaders(String bearer) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (bearer != null) {
            headers.setBearerAuth(bearer);
        }
        return headers;
    }

    private JsonNode body(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }

    private JsonNode data(ResponseEntity<String> response) throws Exception {
        return body(response).path("data");
    }
}
