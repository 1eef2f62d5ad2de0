package com.flagship.credit_ledger.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.ledger.AdminTokenVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class GenerationControllerTest {

    private static final String ADMIN_TOKEN = "operator-test-token";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_generation_api")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("scheduler.enabled", () -> "false");
        registry.add("admin.api-token", () -> ADMIN_TOKEN);
    }

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long userId;

    @BeforeEach
    void setUp() {
        userId = ThreadLocalRandom.current().nextLong(1, 1_000_000_000_000L);
    }

    private void grant(long amount) throws Exception {
        mockMvc.perform(post("/api/admin/credits")
                .header(AdminTokenVerifier.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"userId":%d,"amount":%d,"referenceId":"%s"}""".formatted(userId, amount, UUID.randomUUID())))
            .andExpect(status().isCreated());
    }

    private JsonNode createGeneration() throws Exception {
        String body = mockMvc.perform(post("/api/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"userId":%d,"prompt":"red fox in snow","settings":{"steps":20}}""".formatted(userId)))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("RESERVED"))
            .andExpect(jsonPath("$.cost").value(10))
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    @DisplayName("Full lifecycle over HTTP: create, start, complete")
    void lifecycle() throws Exception {
        grant(50);
        JsonNode generation = createGeneration();
        String jobId = generation.get("jobId").asText();

        mockMvc.perform(get("/api/balances/{userId}", userId))
            .andExpect(jsonPath("$.available").value(40))
            .andExpect(jsonPath("$.reserved").value(10));

        mockMvc.perform(post("/internal/jobs/{jobId}/processing", jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PROCESSING"));

        mockMvc.perform(post("/internal/jobs/{jobId}/complete", jobId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"imageUrl\":\"https://cdn.test/fox.png\",\"seed\":77}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.seed").value(77));

        mockMvc.perform(get("/api/generations/{id}", generation.get("id").asText()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imageUrl").value("https://cdn.test/fox.png"));

        mockMvc.perform(get("/api/balances/{userId}", userId))
            .andExpect(jsonPath("$.available").value(40))
            .andExpect(jsonPath("$.reserved").value(0));

        mockMvc.perform(get("/api/balances/{userId}/transactions", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    @DisplayName("Without enough credits the request is answered with 402")
    void insufficientCredits() throws Exception {
        grant(5);

        mockMvc.perform(post("/api/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":" + userId + ",\"prompt\":\"anything\"}"))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.details.requested").value("10"))
            .andExpect(jsonPath("$.details.available").value("5"));

        mockMvc.perform(get("/api/generations").param("userId", String.valueOf(userId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("A second concurrent job for one user is answered with 429")
    void userLimit() throws Exception {
        grant(100);
        createGeneration();

        mockMvc.perform(post("/api/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":" + userId + ",\"prompt\":\"second\"}"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.details.reason").value("user_limit"));
    }

    @Test
    @DisplayName("Invalid requests are answered with 400")
    void validation() throws Exception {
        mockMvc.perform(post("/api/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":" + userId + ",\"prompt\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.prompt").exists());

        mockMvc.perform(post("/api/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":" + userId + ",\"prompt\":\"x\",\"referenceImages\":[\"a\",\"b\",\"c\",\"d\",\"e\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.referenceImages").exists());
    }

    @Test
    @DisplayName("Cancel refunds; cancelling again is a conflict")
    void cancel() throws Exception {
        grant(10);
        JsonNode generation = createGeneration();
        String id = generation.get("id").asText();

        mockMvc.perform(post("/api/generations/{id}/cancel", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":" + userId + "}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.error").value(JobCoordinator.CANCELLED_BY_USER));

        mockMvc.perform(post("/api/generations/{id}/cancel", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":" + userId + "}"))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/balances/{userId}", userId))
            .andExpect(jsonPath("$.available").value(10));
    }

    @Test
    @DisplayName("Unknown generations and jobs are answered with 404")
    void notFound() throws Exception {
        mockMvc.perform(get("/api/generations/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());

        mockMvc.perform(post("/internal/jobs/{jobId}/fail", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"error\":\"OOM\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Manual grants are idempotent per reference")
    void manualGrantIsIdempotent() throws Exception {
        String body = """
            {"userId":%d,"amount":25,"referenceId":"%s"}""".formatted(userId, UUID.randomUUID());

        mockMvc.perform(post("/api/admin/credits").header(AdminTokenVerifier.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.duplicate").value(false));
        mockMvc.perform(post("/api/admin/credits").header(AdminTokenVerifier.ADMIN_TOKEN_HEADER, ADMIN_TOKEN)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.duplicate").value(true));

        mockMvc.perform(get("/api/balances/{userId}", userId))
            .andExpect(jsonPath("$.available").value(25));
    }

    @Test
    @DisplayName("Manual grants without a valid operator token are refused and grant nothing")
    void manualGrantRequiresOperatorToken() throws Exception {
        String body = """
            {"userId":%d,"amount":1000,"referenceId":"%s"}""".formatted(userId, UUID.randomUUID());

        mockMvc.perform(post("/api/admin/credits").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Authentication Failed"));
        mockMvc.perform(post("/api/admin/credits").header(AdminTokenVerifier.ADMIN_TOKEN_HEADER, "guess")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/balances/{userId}", userId))
            .andExpect(jsonPath("$.available").value(0));
    }
}
