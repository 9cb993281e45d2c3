package dev.ecodata.api;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/** Body of {@code POST /api/jobs/{id}/retry}. */
public record RetryRowsRequest(@NotEmpty List<String> rowIds) {}
