package fr.imt.distroforge.distroforge.business.port;

import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;

import java.nio.file.Path;

/**
 * Masters a bootable image from a configured root filesystem.
 */
public interface ImageMasteringTool {

    /**
     * @return the produced image file, located inside the rootfs workspace
     */
    ToolResult<Path> masterIso(RootfsHandle rootfs, BuildLogSink log);
}
