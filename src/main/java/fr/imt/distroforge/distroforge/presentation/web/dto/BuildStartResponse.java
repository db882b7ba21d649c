package fr.imt.distroforge.distroforge.presentation.web.dto;

public record BuildStartResponse(String buildId) {
}
