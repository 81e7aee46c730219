package com.todo.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.todo.repository.UserSessionRepository;
import com.todo.security.JwtTokenProvider;
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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-End Integration Test for the Authentication Flow.
 *
 * This test verifies:
 * 1. Registration opens a session and returns a bearer token
 * 2. The token reaches protected endpoints
 * 3. Logging out revokes the token even though it has not expired
 * 4. Wrong credentials and duplicate emails are rejected
 *
 * Test Requirements:
 * - PostgreSQL container for the database
 * - Redis container for rate-limit counters
 * - RabbitMQ container for the reminder queue
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Authentication Flow Integration Tests")
class AuthFlowIntegrationTest {

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

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private UserSessionRepository sessionRepository;

    private String baseUrl;
    private String email;

    /**
     * Configure dynamic properties for TestContainers.
     */
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
    void setUp() {
        baseUrl = "http://localhost:" + port;
        // Fresh address per test so the login limiter and unique email never interfere
        email = "user-" + UUID.randomUUID() + "@example.com";
    }

    @Test
    @DisplayName("Register → token → protected endpoint → logout → token revoked")
    void testRegisterLogoutFlow() throws Exception {
        // Step 1: Register
        ResponseEntity<String> registered = post("/api/auth/register", registration(email), null);
        assertEquals(HttpStatus.CREATED, registered.getStatusCode());

        JsonNode body = objectMapper.readTree(registered.getBody());
        assertTrue(body.path("success").asBoolean());
        String token = body.path("data").path("token").asText();
        assertEquals("Bearer", body.path("data").path("token_type").asText());
        assertEquals(email, body.path("data").path("user").path("email").asText());

        // Step 2: The token is bound to an active session
        UUID sessionId = jwtTokenProvider.getSessionIdFromToken(token);
        assertTrue(sessionRepository.findById(sessionId).orElseThrow().getIsActive());

        ResponseEntity<String> me = get("/api/auth/me", token);
        assertEquals(HttpStatus.OK, me.getStatusCode());
        assertEquals("Jane Doe", objectMapper.readTree(me.getBody()).path("data").path("name").asText());

        // Step 3: Logout deactivates the session
        assertEquals(HttpStatus.OK, post("/api/auth/logout", null, token).getStatusCode());

        // Step 4: The unexpired token no longer authenticates
        assertTrue(jwtTokenProvider.validateToken(token));
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/auth/me", token).getStatusCode());
    }

    @Test
    @DisplayName("Login should succeed with the right password and fail with a wrong one")
    void testLogin() throws Exception {
        post("/api/auth/register", registration(email), null);

        ResponseEntity<String> ok = post("/api/auth/login", Map.of("email", email, "password", "secret123"), null);
        assertEquals(HttpStatus.OK, ok.getStatusCode());
        assertFalse(objectMapper.readTree(ok.getBody()).path("data").path("token").asText().isEmpty());

        ResponseEntity<String> wrong = post("/api/auth/login", Map.of("email", email, "password", "nope-nope"), null);
        assertEquals(HttpStatus.UNAUTHORIZED, wrong.getStatusCode());
    }

    @Test
    @DisplayName("Registering an existing email should fail with 422 and a field error")
    void testDuplicateEmail() throws Exception {
        post("/api/auth/register", registration(email), null);

        ResponseEntity<String> duplicate = post("/api/auth/register", registration(email), null);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, duplicate.getStatusCode());
        assertTrue(objectMapper.readTree(duplicate.getBody()).path("errors").has("email"));
    }

    @Test
    @DisplayName("Protected endpoint should return 401 without or with a garbage token")
    void testProtectedEndpointWithoutToken() {
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/tasks", null).getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/tasks", "invalid.jwt.token").getStatusCode());
    }

    private Map<String, Object> registration(String address) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Jane Doe");
        body.put("email", address);
        body.put("password", "secret123");
        body.put("password_confirmation", "secret123");
        return body;
    }

    private ResponseEntity<String> post(String path, Object body, String token) {
        return restTemplate.exchange(baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, headers(token)), String.class);
    }

    private ResponseEntity<String> get(String path, String token) {
        return restTemplate.exchange(baseUrl + path, HttpMethod.GET, new HttpEntity<>(headers(token)), String.class);
    }

    private HttpHeaders headers(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}
