package uk.gegc.xpeconomy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Reader journey over HTTP")
class ReaderJourneyIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("register, read, earn, comment and shop")
    void readerJourney() throws Exception {
        String username = "journey-" + UUID.randomUUID();
        String contentId = "novel-" + UUID.randomUUID();

        MvcResult registered = mockMvc.perform(post("/api/v1/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"" + username + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.spendableXp").value(0))
                .andExpect(jsonPath("$.maxWpm").value(225))
                .andReturn();
        UUID accountId = UUID.fromString(body(registered).get("id").asText());

        mockMvc.perform(post("/api/v1/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"" + username + "\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(put("/api/v1/content/{id}/metrics", contentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"wordCount\": 1000, \"letterCount\": 4800, \"readingLevel\": 8.0}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/accounts/{id}/quiz-attempts", accountId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\": \"" + contentId + "\", \"scorePct\": 100, \"wpmUsed\": 225, \"requestId\": \"grade-1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.reward.xpAwarded").value(900))
                .andExpect(jsonPath("$.progression.newMaxWpm").value(250))
                .andExpect(jsonPath("$.balance.spendableXp").value(950));

        mockMvc.perform(post("/api/v1/accounts/{id}/quiz-attempts", accountId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\": \"" + contentId + "\", \"scorePct\": 100, \"wpmUsed\": 225, \"requestId\": \"grade-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayed").value(true));

        mockMvc.perform(post("/api/v1/social/comments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\": \"" + accountId + "\", \"contentId\": \"" + contentId
                                + "\", \"reply\": false, \"requestId\": \"comment-" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.freeCreditUsed").value(true))
                .andExpect(jsonPath("$.xpCharged").value(0));

        mockMvc.perform(post("/api/v1/accounts/{id}/features/{feature}/purchase", accountId, "5word_chunking"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.xpCharged").value(150))
                .andExpect(jsonPath("$.spendableXp").value(800));

        mockMvc.perform(post("/api/v1/accounts/{id}/features/{feature}/purchase", accountId, "5word_chunking"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.itemId").value("5word_chunking"));

        mockMvc.perform(get("/api/v1/accounts/{id}/balance", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accumulatedXp").value(950))
                .andExpect(jsonPath("$.spendableXp").value(800));

        MvcResult derived = mockMvc.perform(get("/api/v1/accounts/{id}/balance/derived", accountId))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode derivedBody = body(derived);
        assertThat(derivedBody.get("derivedSpendableXp").asLong()).isEqualTo(800);
        assertThat(derivedBody.get("entryCount").asLong()).isEqualTo(3);

        mockMvc.perform(get("/api/v1/admin/monitoring/reconciliation/{id}", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.violations").isEmpty());
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
