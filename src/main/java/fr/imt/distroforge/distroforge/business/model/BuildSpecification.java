package fr.imt.distroforge.distroforge.business.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, normalized and immutable description of the distribution to build.
 * Every {@link PackageCategory} is present in {@link #packages()}.
 */
public record BuildSpecification(
        DistroBase base,
        String kernel,
        InitSystem init,
        Architecture architecture,
        DisplayStack display,
        Map<PackageCategory, List<String>> packages,
        List<String> securityFeatures,
        SystemDefaults defaults) {

    public BuildSpecification {
        EnumMap<PackageCategory, List<String>> normalized = new EnumMap<>(PackageCategory.class);
        for (PackageCategory category : PackageCategory.values()) {
            List<String> names = packages != null ? packages.get(category) : null;
            normalized.put(category, names != null ? List.copyOf(names) : List.of());
        }
        packages = Collections.unmodifiableMap(normalized);
        securityFeatures = securityFeatures != null ? List.copyOf(securityFeatures) : List.of();
        display = display != null ? display : DisplayStack.HEADLESS;
    }

    public List<String> allPackages() {
        return packages.values().stream()
                .flatMap(List::stream)
                .toList();
    }
}
