package fr.imt.distroforge.distroforge.business.port;

import fr.imt.distroforge.distroforge.business.model.BootstrapConfig;
import fr.imt.distroforge.distroforge.business.model.ResolvedPackages;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;

/**
 * Produces a base root filesystem with the resolved packages installed.
 */
public interface FilesystemBootstrapper {

    ToolResult<RootfsHandle> bootstrap(ResolvedPackages packages, BootstrapConfig config, BuildLogSink log);

    /**
     * Drop the root filesystem once no later stage needs it.
     */
    void release(RootfsHandle rootfs);
}
