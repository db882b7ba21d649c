package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.Architecture;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildSpecificationDocument;
import fr.imt.distroforge.distroforge.business.model.DisplayStack;
import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.InitSystem;
import fr.imt.distroforge.distroforge.business.model.PackageCategory;
import fr.imt.distroforge.distroforge.business.model.SystemDefaults;
import fr.imt.distroforge.distroforge.exception.InvalidBuildSpecificationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns a raw specification document into an immutable {@link BuildSpecification}.
 * Every problem found is reported at once; nothing is persisted or logged for a rejected document.
 */
@Service
@RequiredArgsConstructor
public class BuildSpecificationValidator {

    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._+-]*");

    private static final Map<String, String> COMPOSITOR_SERVERS = Map.of(
            "hyprland", "wayland",
            "sway", "wayland",
            "i3", "xorg"
    );

    private final Validator validator;

    public BuildSpecification validate(BuildSpecificationDocument document) {
        if (document == null) {
            throw new InvalidBuildSpecificationException(List.of("specification: must not be null"));
        }

        List<String> violations = new ArrayList<>();
        for (ConstraintViolation<BuildSpecificationDocument> violation : validator.validate(document)) {
            violations.add(violation.getPropertyPath() + ": " + violation.getMessage());
        }

        Optional<DistroBase> base = parse(document.getBase(), DistroBase::fromValue, "base", violations);
        Optional<InitSystem> init = parse(document.getInit(), InitSystem::fromValue, "init", violations);
        Optional<Architecture> architecture = parse(document.getArchitecture(), Architecture::fromValue,
                "architecture", violations);

        if (base.isPresent() && init.isPresent() && !base.get().supports(init.get())) {
            violations.add("init: " + init.get().getValue() + " is not available on " + base.get().getValue());
        }

        Map<PackageCategory, List<String>> packages = validatePackages(document.getPackages(), violations);
        List<String> securityFeatures = validateSecurityFeatures(document.getSecurityFeatures(), violations);
        DisplayStack display = toDisplayStack(document.getDisplay());
        validateDisplay(display, violations);

        if (!violations.isEmpty()) {
            Collections.sort(violations);
            throw new InvalidBuildSpecificationException(violations);
        }

        return new BuildSpecification(
                base.get(),
                document.getKernel().trim(),
                init.get(),
                architecture.get(),
                display,
                packages,
                securityFeatures,
                toDefaults(document.getDefaults()));
    }

    private <T> Optional<T> parse(String value, Function<String, Optional<T>> parser,
                                  String field, List<String> violations) {
        if (value == null || value.isBlank()) {
            // already reported by the bean constraints
            return Optional.empty();
        }
        Optional<T> parsed = parser.apply(value.trim());
        if (parsed.isEmpty()) {
            violations.add(field + ": unsupported value '" + value + "'");
        }
        return parsed;
    }

    private Map<PackageCategory, List<String>> validatePackages(Map<String, List<String>> raw, List<String> violations) {
        Map<PackageCategory, List<String>> packages = new EnumMap<>(PackageCategory.class);
        if (raw == null) {
            return packages;
        }
        raw.forEach((categoryName, names) -> {
            Optional<PackageCategory> category = PackageCategory.fromValue(categoryName);
            if (category.isEmpty()) {
                violations.add("packages: unknown category '" + categoryName + "'");
                return;
            }
            List<String> accepted = new ArrayList<>();
            if (names != null) {
                for (String name : names) {
                    if (name == null || !PACKAGE_NAME.matcher(name).matches()) {
                        violations.add("packages." + categoryName + ": invalid package name '" + name + "'");
                    } else {
                        accepted.add(name);
                    }
                }
            }
            packages.put(category.get(), accepted);
        });
        return packages;
    }

    private List<String> validateSecurityFeatures(List<String> raw, List<String> violations) {
        List<String> features = new ArrayList<>();
        if (raw == null) {
            return features;
        }
        for (int i = 0; i < raw.size(); i++) {
            String feature = raw.get(i);
            if (feature == null || feature.isBlank()) {
                violations.add("securityFeatures[" + i + "]: must not be blank");
            } else {
                features.add(feature.trim());
            }
        }
        return features;
    }

    private DisplayStack toDisplayStack(BuildSpecificationDocument.Display display) {
        if (display == null) {
            return DisplayStack.HEADLESS;
        }
        return new DisplayStack(
                blankToNull(display.getServer()),
                blankToNull(display.getCompositor()),
                blankToNull(display.getBar()),
                blankToNull(display.getLauncher()),
                blankToNull(display.getTerminal()),
                blankToNull(display.getNotifications()),
                blankToNull(display.getLockscreen()));
    }

    private void validateDisplay(DisplayStack display, List<String> violations) {
        if (display.compositor() == null) {
            return;
        }
        String requiredServer = COMPOSITOR_SERVERS.get(display.compositor().toLowerCase(Locale.ROOT));
        if (requiredServer != null && !requiredServer.equalsIgnoreCase(display.server())) {
            violations.add("display.server: " + display.compositor() + " requires " + requiredServer);
        }
        for (String component : display.components()) {
            if (!PACKAGE_NAME.matcher(component).matches()) {
                violations.add("display: invalid component name '" + component + "'");
            }
        }
    }

    private SystemDefaults toDefaults(BuildSpecificationDocument.Defaults defaults) {
        return new SystemDefaults(
                defaults.getSwappiness(),
                defaults.getTrim() == null || defaults.getTrim(),
                blankToNull(defaults.getKernelParams()),
                Boolean.TRUE.equals(defaults.getDnsOverHttps()),
                Boolean.TRUE.equals(defaults.getMacRandomization()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
