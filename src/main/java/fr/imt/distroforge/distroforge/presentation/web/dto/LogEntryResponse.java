package fr.imt.distroforge.distroforge.presentation.web.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class LogEntryResponse {
    private Instant createdAt;
    private String message;
}
