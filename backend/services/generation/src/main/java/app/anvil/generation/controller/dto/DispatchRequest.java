package app.anvil.generation.controller.dto;

import jakarta.validation.constraints.Size;

public record DispatchRequest(
        @Size(max = 8000) String instructions
) {
}
