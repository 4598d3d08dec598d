package com.arbor.hierarchy.api.dto;

import com.arbor.hierarchy.domain.services.HierarchyEngine;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameNodeRequest(@NotBlank @Size(max = HierarchyEngine.MAX_NAME_LENGTH) String name) {}
