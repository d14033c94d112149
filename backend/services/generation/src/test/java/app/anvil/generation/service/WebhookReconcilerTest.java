package app.anvil.generation.service;

import app.anvil.generation.controller.dto.WebhookAck;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.DocumentResult;
import app.anvil.generation.storage.DocumentStore;
import app.anvil.generation.storage.IdeaStore;
import app.anvil.generation.storage.JobStore;
import app.anvil.generation.storage.ResultApplication;
import app.anvil.generation.storage.SystemScope;
import app.anvil.generation.storage.TenantScopedGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookReconcilerTest {

    @Mock
    TenantScopedGateway gateway;

    @Mock
    JobEventPublisher eventPublisher;

    @Mock
    SystemScope scope;

    @Mock
    JobStore jobs;

    @Mock
    DocumentStore documents;

    @Mock
    IdeaStore ideas;

    private WebhookReconciler reconciler;
    private ProjectDocumentEntity document;

    @BeforeEach
    void setUp() {
        reconciler = new WebhookReconciler(gateway, new GenerationResultApplier(eventPublisher));
        lenient().when(gateway.withSystemScope(any())).thenAnswer(inv -> inv.<Function<SystemScope, Object>>getArgument(0).apply(scope));
        lenient().when(scope.jobs()).thenReturn(jobs);
        lenient().when(scope.documents()).thenReturn(documents);
        lenient().when(scope.ideas()).thenReturn(ideas);

        document = new ProjectDocumentEntity();
        document.setId(UUID.randomUUID());
        document.setUserId(UUID.randomUUID());
        document.setIdeaId(UUID.randomUUID());
        document.setJobId(UUID.randomUUID());
        document.setDocumentType(DocumentKind.BusinessRequirements);
        document.setStatus(DocumentStatus.Generating);
        document.setExternalId("brd-7");
    }

    @Test
    void reconcile_repeatedCallbackPublishesDoneOnce() {
        DocumentResult result = new DocumentResult(DocumentStatus.Completed, "<p>brd</p>", null, null, "brd-7");
        WebhookPayload payload = new WebhookPayload(document.getIdeaId(), DocumentKind.BusinessRequirements, result, null, null);
        when(documents.findByExternalId(document.getIdeaId(), DocumentKind.BusinessRequirements, "brd-7"))
                .thenReturn(Optional.of(document));
        when(documents.applyResult(document.getId(), result))
                .thenReturn(ResultApplication.APPLIED, ResultApplication.CONTENT_REFRESHED);
        when(jobs.promoteIfActive(document.getJobId(), JobStatus.completed, "Generation completed"))
                .thenReturn(true, false);

        WebhookAck first = reconciler.reconcile(payload);
        WebhookAck second = reconciler.reconcile(payload);

        assertThat(first.matched()).isTrue();
        assertThat(first.jobPromoted()).isTrue();
        assertThat(second.matched()).isTrue();
        assertThat(second.jobPromoted()).isFalse();
        verify(eventPublisher, times(1)).publish(eq(document.getJobId()), eq(JobEventType.done), anyMap());
    }

    @Test
    void reconcile_fallsBackToLatestDocument() {
        DocumentResult result = new DocumentResult(DocumentStatus.Completed, "<p>brd</p>", null, null, "brd-new");
        WebhookPayload payload = new WebhookPayload(document.getIdeaId(), DocumentKind.BusinessRequirements, result, null, null);
        when(documents.findByExternalId(document.getIdeaId(), DocumentKind.BusinessRequirements, "brd-new"))
                .thenReturn(Optional.empty());
        when(documents.findLatest(document.getIdeaId(), DocumentKind.BusinessRequirements)).thenReturn(Optional.of(document));
        when(documents.applyResult(document.getId(), result)).thenReturn(ResultApplication.APPLIED);
        when(jobs.promoteIfActive(document.getJobId(), JobStatus.completed, "Generation completed")).thenReturn(true);

        WebhookAck ack = reconciler.reconcile(payload);

        assertThat(ack.documentId()).isEqualTo(document.getId());
        assertThat(ack.jobId()).isEqualTo(document.getJobId());
        verify(documents).recordExternalId(document.getId(), "brd-new");
    }

    @Test
    void reconcile_acknowledgesUnmatchedCallback() {
        DocumentResult result = DocumentResult.failed(null);
        WebhookPayload payload = new WebhookPayload(UUID.randomUUID(), DocumentKind.Workflows, result, null, "boom");
        when(documents.findByExternalId(payload.ideaId(), DocumentKind.Workflows, null)).thenReturn(Optional.empty());
        when(documents.findLatest(payload.ideaId(), DocumentKind.Workflows)).thenReturn(Optional.empty());

        WebhookAck ack = reconciler.reconcile(payload);

        assertThat(ack.matched()).isFalse();
        verify(documents, never()).applyResult(any(), any());
        verify(eventPublisher, never()).publish(any(), any(), anyMap());
    }
}
