package com.payment.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Ingestion API, event queries and alert detection against real storage.
 * Uses Embedded Kafka plus Testcontainers PostgreSQL and Redis; skipped when Docker is not available.
 * Run with: mvn test -DincludeTags=integration
 */
@Tag("integration")
@SpringBootTest(classes = PaymentObservabilityApplication.class)
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "normalized-payment-events", "payment-alerts" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers(disabledWithoutDocker = true)
class IngestionAndAlertsIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @DynamicPropertySource
    static void infrastructureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("payment.datalake.url", postgres::getJdbcUrl);
        registry.add("payment.datalake.username", postgres::getUsername);
        registry.add("payment.datalake.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @Test
    @DisplayName("Stripe event is normalized by rules, stored and readable by id")
    void ingestStripeEventThenFetch() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "rawEvent": {
                                    "id": "pi_int_1",
                                    "object": "payment_intent",
                                    "amount": 2500,
                                    "currency": "usd",
                                    "status": "succeeded",
                                    "metadata": { "merchant_id": "shop_int" }
                                  }
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.normalizationMethod").value("rule_based"))
                .andReturn();

        JsonNode body = objectMapper.readTree(created.getResponse().getContentAsString());
        mockMvc.perform(get("/api/v1/events/{id}", body.get("id").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.provider").value("stripe"))
                .andExpect(jsonPath("$.merchantName").value("shop_int"));
    }

    @Test
    @DisplayName("GET /alerts returns a summary with severity buckets")
    void alertsEndpointReturnsSummary() throws Exception {
        mockMvc.perform(get("/api/v1/alerts").param("windowHours", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerts").isArray())
                .andExpect(jsonPath("$.bySeverity.critical").exists());
    }
}
