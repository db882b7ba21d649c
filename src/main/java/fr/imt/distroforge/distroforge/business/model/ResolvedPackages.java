package fr.imt.distroforge.distroforge.business.model;

import java.util.List;

/**
 * Distribution-specific package names, deduplicated, plus the names that were dropped.
 */
public record ResolvedPackages(DistroBase distro, List<String> packages, List<String> warnings) {

    public ResolvedPackages {
        packages = List.copyOf(packages);
        warnings = List.copyOf(warnings);
    }
}
