package com.supportgenius.knowledge.model;

import jakarta.validation.constraints.NotBlank;

public record ContextRequest(@NotBlank String query) {
}
