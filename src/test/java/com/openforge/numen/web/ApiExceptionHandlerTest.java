package com.openforge.numen.web;

import com.openforge.numen.agent.AgentController;
import com.openforge.numen.agent.ChatController;
import com.openforge.numen.agent.InteractionOrchestrator;
import com.openforge.numen.agent.InteractionResult;
import com.openforge.numen.config.AppConfig;
import com.openforge.numen.contract.ContractService;
import com.openforge.numen.error.ConflictException;
import com.openforge.numen.error.ContractValidationException;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.error.ProviderException;
import com.openforge.numen.error.ProviderTimeoutException;
import com.openforge.numen.memory.MemoryController;
import com.openforge.numen.memory.MemoryManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {AgentController.class, ChatController.class, MemoryController.class})
@Import(AppConfig.class)
class ApiExceptionHandlerTest {

    @Autowired private MockMvc mvc;

    @MockBean private ContractService contractService;
    @MockBean private InteractionOrchestrator orchestrator;
    @MockBean private MemoryManager memoryManager;

    private static final String CHAT = "/api/agents/A/chat";

    @Test
    void chatReturnsSnakeCaseResult() throws Exception {
        when(orchestrator.process("A", "T", "U", "hi", null))
                .thenReturn(new InteractionResult("th-1", "hello", Map.of("message_count", 2)));

        mvc.perform(post(CHAT).header(RequestHeaders.TENANT, "T").header(RequestHeaders.USER, "U")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.thread_id").value("th-1"))
                .andExpect(jsonPath("$.response").value("hello"))
                .andExpect(jsonPath("$.metadata.message_count").value(2));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mvc.perform(post(CHAT).header(RequestHeaders.TENANT, "T").header(RequestHeaders.USER, "U")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.violations[0]").value("message: message must not be blank"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void overlongMemoryTypeIsRejected() throws Exception {
        String type = "x".repeat(33);

        mvc.perform(post("/api/agents/A/memories").header(RequestHeaders.TENANT, "T").header(RequestHeaders.USER, "U")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"likes tea\",\"memory_type\":\"" + type + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
        verifyNoInteractions(memoryManager);
    }

    @Test
    void missingTenantHeaderIsABadRequest() throws Exception {
        mvc.perform(get("/api/agents/A"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void unknownAgentIs404() throws Exception {
        when(contractService.get("A", "T")).thenThrow(NotFoundException.agent("A", "T"));

        mvc.perform(get("/api/agents/A").header(RequestHeaders.TENANT, "T"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void invalidContractListsViolations() throws Exception {
        when(contractService.create(any()))
                .thenThrow(new ContractValidationException(List.of("name is required", "type is required")));

        mvc.perform(post("/api/agents").header(RequestHeaders.TENANT, "T").header(RequestHeaders.USER, "U")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.violations.length()").value(2))
                .andExpect(jsonPath("$.violations[1]").value("type is required"));
    }

    @Test
    void staleVersionIs409() throws Exception {
        when(contractService.update(eq("A"), eq("T"), any())).thenThrow(new ConflictException("stale"));

        mvc.perform(patch("/api/agents/A").header(RequestHeaders.TENANT, "T")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"New\",\"expected_version\":\"1.0.0\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"));
    }

    @Test
    void providerTimeoutIs504AndRetryable() throws Exception {
        when(orchestrator.process(any(), any(), any(), any(), any()))
                .thenThrow(new ProviderTimeoutException("timed out", null));

        mvc.perform(post(CHAT).header(RequestHeaders.TENANT, "T").header(RequestHeaders.USER, "U")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"hi\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("provider_timeout"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void providerFailureIs502() throws Exception {
        when(orchestrator.process(any(), any(), any(), any(), any()))
                .thenThrow(new ProviderException("HTTP 500"));

        mvc.perform(post(CHAT).header(RequestHeaders.TENANT, "T").header(RequestHeaders.USER, "U")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"hi\"}"))
                .andExpect(status().isBadGateway());
    }
}
