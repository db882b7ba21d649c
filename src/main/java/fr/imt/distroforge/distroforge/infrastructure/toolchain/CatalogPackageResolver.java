package fr.imt.distroforge.distroforge.infrastructure.toolchain;

import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.ResolvedPackages;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.business.port.PackageResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves packages against the {@link PackageCatalog}. Unknown names are kept as given,
 * names known to be unavailable on the distribution are dropped with a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogPackageResolver implements PackageResolver {

    private final PackageCatalog packageCatalog;

    @Override
    public ToolResult<ResolvedPackages> resolve(DistroBase distro, Map<String, List<String>> categories, BuildLogSink logSink) {
        Set<String> packages = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();

        categories.forEach((category, names) -> {
            for (String name : names) {
                Optional<String> resolved = packageCatalog.lookup(name, distro);
                if (resolved.isPresent()) {
                    packages.add(resolved.get());
                } else {
                    warnings.add("Package '" + name + "' (" + category + ") is not available on " + distro.getValue());
                }
            }
        });

        log.debug("Resolved {} packages for {} with {} warnings", packages.size(), distro.getValue(), warnings.size());
        return ToolResult.success(new ResolvedPackages(distro, List.copyOf(packages), warnings));
    }
}
