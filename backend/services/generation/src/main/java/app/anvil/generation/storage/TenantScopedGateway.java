package app.anvil.generation.storage;

import app.anvil.generation.config.StorageProps;
import app.anvil.generation.repository.GenerationJobRepository;
import app.anvil.generation.repository.IdeaRepository;
import app.anvil.generation.repository.ProjectDocumentRepository;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Function;

/**
 * The only entry point to the stores. Every call runs in its own transaction; tenant calls apply
 * the session context that the row policies read before handing out store handles.
 */
@Component
public class TenantScopedGateway {

    private static final Logger log = LoggerFactory.getLogger(TenantScopedGateway.class);

    private static final String APPLY_SESSION_CONTEXT =
            "select set_config('role', ?, true), set_config('request.jwt.claim.sub', ?, true)";

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final EntityManager entityManager;
    private final GenerationJobRepository jobRepository;
    private final ProjectDocumentRepository documentRepository;
    private final IdeaRepository ideaRepository;
    private final StorageProps props;
    private final Clock clock;

    public TenantScopedGateway(TransactionTemplate transactionTemplate,
                               JdbcTemplate jdbcTemplate,
                               EntityManager entityManager,
                               GenerationJobRepository jobRepository,
                               ProjectDocumentRepository documentRepository,
                               IdeaRepository ideaRepository,
                               StorageProps props,
                               Clock clock) {
        this.transactionTemplate = transactionTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.entityManager = entityManager;
        this.jobRepository = jobRepository;
        this.documentRepository = documentRepository;
        this.ideaRepository = ideaRepository;
        this.props = props;
        this.clock = clock;
    }

    public <T> T withTenantScope(UUID tenantId, Function<TenantScope, T> work) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId is required");
        }
        return transactionTemplate.execute(status -> {
            applySessionContext(tenantId);
            return work.apply(new TenantHandle(tenantId));
        });
    }

    public <T> T withSystemScope(Function<SystemScope, T> work) {
        return transactionTemplate.execute(status -> work.apply(new SystemHandle()));
    }

    private void applySessionContext(UUID tenantId) {
        if (!props.rowSecurity()) {
            return;
        }
        try {
            jdbcTemplate.queryForList(APPLY_SESSION_CONTEXT, props.tenantRole(), tenantId.toString());
        } catch (DataAccessException ex) {
            log.error("Failed to apply storage session context tenantId={}", tenantId, ex);
            throw new TenantScopeException("Storage scope unavailable", ex);
        }
    }

    private abstract class Handle implements StorageScope {
        private final JobStore jobs;
        private final DocumentStore documents;
        private final IdeaStore ideas;

        Handle(UUID tenantId) {
            this.jobs = new JobStore(jobRepository, jdbcTemplate, entityManager, clock, tenantId);
            this.documents = new DocumentStore(documentRepository, jdbcTemplate, entityManager, clock, tenantId);
            this.ideas = new IdeaStore(ideaRepository, jdbcTemplate, entityManager, clock, tenantId);
        }

        @Override
        public JobStore jobs() {
            return jobs;
        }

        @Override
        public DocumentStore documents() {
            return documents;
        }

        @Override
        public IdeaStore ideas() {
            return ideas;
        }
    }

    private final class TenantHandle extends Handle implements TenantScope {
        private final UUID tenantId;

        TenantHandle(UUID tenantId) {
            super(tenantId);
            this.tenantId = tenantId;
        }

        @Override
        public UUID tenantId() {
            return tenantId;
        }
    }

    private final class SystemHandle extends Handle implements SystemScope {
        SystemHandle() {
            super(null);
        }
    }
}
