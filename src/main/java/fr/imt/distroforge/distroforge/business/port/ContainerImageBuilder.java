package fr.imt.distroforge.distroforge.business.port;

import fr.imt.distroforge.distroforge.business.model.ContainerImage;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;

/**
 * Builds a container image from a configured root filesystem.
 */
public interface ContainerImageBuilder {

    ToolResult<ContainerImage> buildImage(RootfsHandle rootfs, BuildLogSink log);
}
