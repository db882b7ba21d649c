package fr.imt.distroforge.distroforge.business.model;

import java.nio.file.Path;

public record BootstrapConfig(
        String buildId,
        DistroBase base,
        Architecture architecture,
        String kernel,
        InitSystem init,
        Path workspace) {
}
