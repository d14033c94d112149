package app.anvil.generation.controller;

import app.anvil.generation.config.CorsProps;
import app.anvil.generation.config.SecurityConfig;
import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.security.CurrentTenantProvider;
import app.anvil.generation.service.DispatchResult;
import app.anvil.generation.service.GenerationDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GenerationController.class)
@Import({SecurityConfig.class, CurrentTenantProvider.class})
@EnableConfigurationProperties(CorsProps.class)
@ActiveProfiles("test")
class GenerationControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    GenerationDispatcher dispatcher;

    @MockitoBean
    JwtDecoder jwtDecoder;

    private final UUID tenantId = UUID.randomUUID();
    private final UUID ideaId = UUID.randomUUID();

    @Test
    void generate_returnsAcceptedWithJobAndDocument() throws Exception {
        when(dispatcher.dispatch(eq(tenantId), eq(ideaId), eq(DocumentKind.LeanCanvas), eq("Focus on B2B")))
                .thenReturn(result(false));

        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/generate", ideaId, "canvas")
                        .with(jwt().jwt(j -> j.claim("user_id", tenantId.toString())))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instructions\":\"Focus on B2B\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job.status").value("pending"))
                .andExpect(jsonPath("$.document.status").value("Generating"))
                .andExpect(jsonPath("$.duplicate").value(false));
    }

    @Test
    void generate_acceptsMissingBody() throws Exception {
        when(dispatcher.dispatch(eq(tenantId), eq(ideaId), eq(DocumentKind.Workflows), isNull()))
                .thenReturn(result(true));

        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/generate", ideaId, "Workflows")
                        .with(jwt().jwt(j -> j.claim("user_id", tenantId.toString()))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    void retry_delegatesToDispatcher() throws Exception {
        when(dispatcher.retry(eq(tenantId), eq(ideaId), eq(DocumentKind.ProjectRequirements), isNull()))
                .thenReturn(result(false));

        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/retry", ideaId, "requirements")
                        .with(jwt().jwt(j -> j.claim("user_id", tenantId.toString()))))
                .andExpect(status().isAccepted());

        verify(dispatcher).retry(tenantId, ideaId, DocumentKind.ProjectRequirements, null);
    }

    @Test
    void generate_rejectsTokenWithoutTenant() throws Exception {
        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/generate", ideaId, "canvas")
                        .with(jwt().jwt(j -> j.claim("sub", "someone"))))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(dispatcher);
    }

    @Test
    void generate_rejectsAnonymousCaller() throws Exception {
        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/generate", ideaId, "canvas"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void generate_rejectsUnknownKind() throws Exception {
        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/generate", ideaId, "pitch-deck")
                        .with(jwt().jwt(j -> j.claim("user_id", tenantId.toString()))))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dispatcher);
    }

    @Test
    void generate_rejectsOversizedInstructions() throws Exception {
        String instructions = "x".repeat(8001);

        mockMvc.perform(post("/ideas/{ideaId}/documents/{kind}/generate", ideaId, "canvas")
                        .with(jwt().jwt(j -> j.claim("user_id", tenantId.toString())))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instructions\":\"" + instructions + "\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dispatcher);
    }

    private DispatchResult result(boolean duplicate) {
        Instant now = Instant.now();
        GenerationJobEntity job = new GenerationJobEntity(UUID.randomUUID(), tenantId, ideaId, DocumentKind.LeanCanvas,
                JobStatus.pending, "Generation requested", now, now);
        ProjectDocumentEntity document = new ProjectDocumentEntity();
        document.setId(UUID.randomUUID());
        document.setUserId(tenantId);
        document.setIdeaId(ideaId);
        document.setJobId(job.getId());
        document.setDocumentType(DocumentKind.LeanCanvas);
        document.setTitle(DocumentKind.LeanCanvas.title());
        document.setStatus(DocumentStatus.Generating);
        document.setGenerationStartedAt(now);
        return new DispatchResult(job, document, duplicate);
    }
}
