package app.anvil.generation.service;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.entity.IdeaEntity;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.DocumentStore;
import app.anvil.generation.storage.IdeaStore;
import app.anvil.generation.storage.JobStore;
import app.anvil.generation.storage.TenantScope;
import app.anvil.generation.storage.TenantScopedGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationDispatcherTest {

    @Mock
    TenantScopedGateway gateway;

    @Mock
    GenerationTaskPublisher taskPublisher;

    @Mock
    JobEventPublisher eventPublisher;

    @Mock
    TenantScope scope;

    @Mock
    JobStore jobs;

    @Mock
    DocumentStore documents;

    @Mock
    IdeaStore ideas;

    private final UUID tenantId = UUID.randomUUID();
    private final UUID ideaId = UUID.randomUUID();
    private GenerationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new GenerationDispatcher(gateway, taskPublisher, eventPublisher);
        lenient().when(scope.jobs()).thenReturn(jobs);
        lenient().when(scope.documents()).thenReturn(documents);
        lenient().when(scope.ideas()).thenReturn(ideas);
        lenient().when(scope.tenantId()).thenReturn(tenantId);
        lenient().when(gateway.withTenantScope(eq(tenantId), any()))
                .thenAnswer(inv -> inv.<Function<TenantScope, Object>>getArgument(1).apply(scope));
    }

    @Test
    void dispatch_createsJobAndSubmitsTaskWithSiblingIds() {
        GenerationJobEntity job = job(JobStatus.pending, DocumentKind.ProjectRequirements);
        ProjectDocumentEntity document = document(job.getId(), DocumentKind.ProjectRequirements);
        when(ideas.getIdea(ideaId)).thenReturn(Optional.of(idea()));
        when(jobs.findActiveJob(ideaId, DocumentKind.ProjectRequirements)).thenReturn(Optional.empty());
        when(jobs.createJob(ideaId, DocumentKind.ProjectRequirements, JobStatus.pending)).thenReturn(job);
        when(documents.startGeneration(ideaId, DocumentKind.ProjectRequirements, job.getId())).thenReturn(document);
        when(documents.externalIds(ideaId)).thenReturn(Map.of(DocumentKind.LeanCanvas, "lc-1"));
        when(jobs.getJob(job.getId())).thenReturn(Optional.of(job));
        when(documents.getDocument(document.getId())).thenReturn(Optional.of(document));

        DispatchResult result = dispatcher.dispatch(tenantId, ideaId, DocumentKind.ProjectRequirements, "Keep it short");

        ArgumentCaptor<GenerationTask> task = ArgumentCaptor.forClass(GenerationTask.class);
        verify(taskPublisher).submit(task.capture());
        assertThat(task.getValue().jobId()).isEqualTo(job.getId());
        assertThat(task.getValue().documentId()).isEqualTo(document.getId());
        assertThat(task.getValue().tenantId()).isEqualTo(tenantId);
        assertThat(task.getValue().instructions()).isEqualTo("Keep it short");
        assertThat(task.getValue().correlationIds()).containsEntry(DocumentKind.LeanCanvas, "lc-1");
        assertThat(result.duplicate()).isFalse();
        assertThat(result.job()).isSameAs(job);
        verify(ideas, never()).markGenerating(any());
    }

    @Test
    void dispatch_marksIdeaGeneratingForLeanCanvas() {
        GenerationJobEntity job = job(JobStatus.pending, DocumentKind.LeanCanvas);
        ProjectDocumentEntity document = document(job.getId(), DocumentKind.LeanCanvas);
        when(ideas.getIdea(ideaId)).thenReturn(Optional.of(idea()));
        when(jobs.findActiveJob(ideaId, DocumentKind.LeanCanvas)).thenReturn(Optional.empty());
        when(jobs.createJob(ideaId, DocumentKind.LeanCanvas, JobStatus.pending)).thenReturn(job);
        when(documents.startGeneration(ideaId, DocumentKind.LeanCanvas, job.getId())).thenReturn(document);
        when(documents.externalIds(ideaId)).thenReturn(Map.of());

        dispatcher.dispatch(tenantId, ideaId, DocumentKind.LeanCanvas, null);

        verify(ideas).markGenerating(ideaId);
        verify(taskPublisher).submit(any(GenerationTask.class));
    }

    @Test
    void dispatch_returnsActiveJobWithoutNewGeneration() {
        GenerationJobEntity active = job(JobStatus.processing, DocumentKind.LeanCanvas);
        when(ideas.getIdea(ideaId)).thenReturn(Optional.of(idea()));
        when(jobs.findActiveJob(ideaId, DocumentKind.LeanCanvas)).thenReturn(Optional.of(active));
        when(documents.findLatest(ideaId, DocumentKind.LeanCanvas)).thenReturn(Optional.empty());

        DispatchResult result = dispatcher.dispatch(tenantId, ideaId, DocumentKind.LeanCanvas, null);

        assertThat(result.duplicate()).isTrue();
        assertThat(result.job()).isSameAs(active);
        verify(jobs, never()).createJob(any(), any(), any());
        verify(taskPublisher, never()).submit(any());
    }

    @Test
    void dispatch_returnsWinnerWhenUniqueIndexRejectsConcurrentJob() {
        GenerationJobEntity winner = job(JobStatus.pending, DocumentKind.LeanCanvas);
        AtomicInteger calls = new AtomicInteger();
        doAnswer(inv -> {
            if (calls.getAndIncrement() == 0) {
                throw new DataIntegrityViolationException("generation_jobs_one_active_uq");
            }
            return inv.<Function<TenantScope, Object>>getArgument(1).apply(scope);
        }).when(gateway).withTenantScope(eq(tenantId), any());
        when(jobs.findActiveJob(ideaId, DocumentKind.LeanCanvas)).thenReturn(Optional.of(winner));
        when(documents.findLatest(ideaId, DocumentKind.LeanCanvas)).thenReturn(Optional.empty());

        DispatchResult result = dispatcher.dispatch(tenantId, ideaId, DocumentKind.LeanCanvas, null);

        assertThat(result.duplicate()).isTrue();
        assertThat(result.job()).isSameAs(winner);
        verify(taskPublisher, never()).submit(any());
    }

    @Test
    void dispatch_rejectsUnknownIdea() {
        when(ideas.getIdea(ideaId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> dispatcher.dispatch(tenantId, ideaId, DocumentKind.LeanCanvas, null))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
        verify(taskPublisher, never()).submit(any());
    }

    @Test
    void retry_supersedesActiveJobBeforeDispatching() {
        GenerationJobEntity stale = job(JobStatus.processing, DocumentKind.BusinessRequirements);
        GenerationJobEntity fresh = job(JobStatus.pending, DocumentKind.BusinessRequirements);
        ProjectDocumentEntity document = document(fresh.getId(), DocumentKind.BusinessRequirements);
        when(ideas.getIdea(ideaId)).thenReturn(Optional.of(idea()));
        when(jobs.findActiveJob(ideaId, DocumentKind.BusinessRequirements))
                .thenReturn(Optional.of(stale))
                .thenReturn(Optional.empty());
        when(jobs.promoteIfActive(stale.getId(), JobStatus.failed, "Superseded by retry")).thenReturn(true);
        when(jobs.createJob(ideaId, DocumentKind.BusinessRequirements, JobStatus.pending)).thenReturn(fresh);
        when(documents.startGeneration(ideaId, DocumentKind.BusinessRequirements, fresh.getId())).thenReturn(document);
        when(documents.externalIds(ideaId)).thenReturn(Map.of());

        DispatchResult result = dispatcher.retry(tenantId, ideaId, DocumentKind.BusinessRequirements, null);

        verify(eventPublisher).publish(eq(stale.getId()), eq(JobEventType.error), anyMap());
        assertThat(result.duplicate()).isFalse();
        ArgumentCaptor<GenerationTask> task = ArgumentCaptor.forClass(GenerationTask.class);
        verify(taskPublisher).submit(task.capture());
        assertThat(task.getValue().jobId()).isEqualTo(fresh.getId());
    }

    private IdeaEntity idea() {
        IdeaEntity idea = new IdeaEntity();
        idea.setId(ideaId);
        idea.setUserId(tenantId);
        idea.setTitle("Tool rental");
        idea.setDescription("Rent power tools from neighbours");
        return idea;
    }

    private GenerationJobEntity job(JobStatus status, DocumentKind kind) {
        Instant now = Instant.now();
        return new GenerationJobEntity(UUID.randomUUID(), tenantId, ideaId, kind, status, null, now, now);
    }

    private ProjectDocumentEntity document(UUID jobId, DocumentKind kind) {
        ProjectDocumentEntity document = new ProjectDocumentEntity();
        document.setId(UUID.randomUUID());
        document.setUserId(tenantId);
        document.setIdeaId(ideaId);
        document.setJobId(jobId);
        document.setDocumentType(kind);
        document.setTitle(kind.title());
        document.setStatus(DocumentStatus.Generating);
        return document;
    }
}
