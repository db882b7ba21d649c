package fr.imt.distroforge.distroforge.presentation.web;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.BuildSpecificationDocument;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.business.service.ArtifactRegistry;
import fr.imt.distroforge.distroforge.business.service.BuildDispatcher;
import fr.imt.distroforge.distroforge.business.utils.FileNameSanitizer;
import fr.imt.distroforge.distroforge.presentation.web.dto.ArtifactUrlResponse;
import fr.imt.distroforge.distroforge.presentation.web.dto.BuildStartResponse;
import fr.imt.distroforge.distroforge.presentation.web.dto.BuildStatusResponse;
import fr.imt.distroforge.distroforge.presentation.web.dto.RegistryImageResponse;
import fr.imt.distroforge.distroforge.presentation.web.dto.mappers.BuildStatusMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/build")
@RequiredArgsConstructor
public class BuildController {

    private final BuildDispatcher buildDispatcher;
    private final BuildRecordStore buildRecordStore;
    private final ArtifactRegistry artifactRegistry;
    private final BuildStatusMapper buildStatusMapper;

    @PostMapping("/start")
    public ResponseEntity<BuildStartResponse> startBuild(@RequestBody BuildSpecificationDocument specification) {
        String buildId = buildDispatcher.submit(specification);
        return ResponseEntity.accepted().body(new BuildStartResponse(buildId));
    }

    @GetMapping("/status/{buildId}")
    public BuildStatusResponse getStatus(@PathVariable String buildId) {
        return buildStatusMapper.toResponse(buildRecordStore.get(buildId));
    }

    @GetMapping("/artifact/{buildId}")
    public ArtifactUrlResponse getArtifact(@PathVariable String buildId) {
        return new ArtifactUrlResponse(artifactRegistry.first(buildId).url());
    }

    @GetMapping("/download/{buildId}/{type}")
    public ResponseEntity<?> download(@PathVariable String buildId, @PathVariable String type) {
        Artifact artifact = artifactRegistry.resolveDownload(buildId, type);
        if (!artifact.isStoredFile()) {
            return ResponseEntity.ok(RegistryImageResponse.of(artifact.url()));
        }

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(FileNameSanitizer.sanitize(artifact.fileName()))
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(new FileSystemResource(artifact.location()));
    }
}
