package io.kneo.autoflow.dto;

import io.kneo.autoflow.service.scheduler.ConflictingFlow;

import java.util.List;

public record ConflictReportDTO(String message, List<ConflictingFlow> conflicts) {
}
