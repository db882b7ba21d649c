package fr.imt.distroforge.distroforge.presentation.web.dto.mappers;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.LogEntry;
import fr.imt.distroforge.distroforge.presentation.web.dto.ArtifactResponse;
import fr.imt.distroforge.distroforge.presentation.web.dto.BuildStatusResponse;
import fr.imt.distroforge.distroforge.presentation.web.dto.LogEntryResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface BuildStatusMapper {

    BuildStatusResponse toResponse(BuildSnapshot snapshot);

    LogEntryResponse toResponse(LogEntry logEntry);

    @Mapping(target = "fileType", source = "fileType.wireName")
    ArtifactResponse toResponse(Artifact artifact);
}
