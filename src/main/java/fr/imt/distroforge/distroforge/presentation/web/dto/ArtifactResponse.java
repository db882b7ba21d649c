package fr.imt.distroforge.distroforge.presentation.web.dto;

import lombok.Data;

@Data
public class ArtifactResponse {
    private String fileType;
    private String fileName;
    private String url;
}
