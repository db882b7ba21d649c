package fr.imt.distroforge.distroforge.presentation.web.dto;

public record ArtifactUrlResponse(String url) {
}
