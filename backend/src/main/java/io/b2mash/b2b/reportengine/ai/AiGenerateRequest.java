package io.b2mash.b2b.reportengine.ai;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AiGenerateRequest(@NotBlank @Size(max = 2000) String query) {}
