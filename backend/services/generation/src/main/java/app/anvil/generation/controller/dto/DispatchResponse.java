package app.anvil.generation.controller.dto;

import app.anvil.generation.service.DispatchResult;

public record DispatchResponse(
        JobResponse job,
        DocumentResponse document,
        boolean duplicate
) {
    public static DispatchResponse from(DispatchResult result) {
        return new DispatchResponse(
                JobResponse.from(result.job()),
                DocumentResponse.from(result.document()),
                result.duplicate()
        );
    }
}
