package fr.imt.distroforge.distroforge.business.port;

import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.ResolvedPackages;
import fr.imt.distroforge.distroforge.business.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Maps requested package names, grouped by category, to the packages of a distribution.
 */
public interface PackageResolver {

    ToolResult<ResolvedPackages> resolve(DistroBase distro, Map<String, List<String>> categories, BuildLogSink log);
}
