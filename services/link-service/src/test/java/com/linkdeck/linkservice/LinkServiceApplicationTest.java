package com.linkdeck.linkservice;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.linkdeck.linkservice.infrastructure.web.CorrelationIdFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full context with the real provider-cookie strategy pointed at an unreachable
 * provider.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("LinkServiceApplication")
class LinkServiceApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Test
    @DisplayName("exposes a health endpoint")
    void health() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("echoes a supplied correlation id")
    void correlationId() throws Exception {
        mvc.perform(get("/api/auth/validate").header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-123"));
    }

    @Test
    @DisplayName("fails closed when the identity provider is unreachable")
    void providerDown() throws Exception {
        mvc.perform(get("/api/auth/validate").header("Cookie", "sso_session=abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isValid").value(false));
    }

    @Test
    @DisplayName("unknown routes answer with the error payload")
    void unknownRoute() throws Exception {
        mvc.perform(get("/api/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").exists());
    }
}
