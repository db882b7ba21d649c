package fr.imt.distroforge.distroforge.business.model;

import java.time.Instant;

public record LogEntry(Instant createdAt, String message) {
}
