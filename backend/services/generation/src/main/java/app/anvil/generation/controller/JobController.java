package app.anvil.generation.controller;

import app.anvil.generation.controller.dto.JobResponse;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.security.CurrentTenantProvider;
import app.anvil.generation.service.JobQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobQueryService jobQueryService;
    private final CurrentTenantProvider tenantProvider;

    public JobController(JobQueryService jobQueryService, CurrentTenantProvider tenantProvider) {
        this.jobQueryService = jobQueryService;
        this.tenantProvider = tenantProvider;
    }

    @GetMapping("/latest")
    public JobResponse latest(@AuthenticationPrincipal Jwt jwt,
                              @RequestParam UUID ideaId,
                              @RequestParam(required = false) DocumentKind kind) {
        return JobResponse.from(jobQueryService.getLatestJob(requireTenantId(jwt), ideaId, kind));
    }

    @GetMapping("/{jobId}")
    public JobResponse getJob(@AuthenticationPrincipal Jwt jwt,
                              @PathVariable UUID jobId) {
        return JobResponse.from(jobQueryService.getJob(requireTenantId(jwt), jobId));
    }

    private UUID requireTenantId(Jwt jwt) {
        try {
            return tenantProvider.requireTenantId(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }
}
