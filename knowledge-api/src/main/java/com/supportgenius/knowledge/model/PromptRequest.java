package com.supportgenius.knowledge.model;

import jakarta.validation.constraints.NotBlank;

public record PromptRequest(@NotBlank String query,
                            @NotBlank String name,
                            String tone,
                            String instructions) {
}
