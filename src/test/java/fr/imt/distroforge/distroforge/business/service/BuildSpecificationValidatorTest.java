package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.Architecture;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildSpecificationDocument;
import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.InitSystem;
import fr.imt.distroforge.distroforge.business.model.PackageCategory;
import fr.imt.distroforge.distroforge.exception.InvalidBuildSpecificationException;
import fr.imt.distroforge.distroforge.support.BuildSpecifications;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuildSpecificationValidatorTest {

    private BuildSpecificationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new BuildSpecificationValidator(Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    void acceptsCompleteDocument() {
        BuildSpecification spec = validator.validate(BuildSpecifications.archHyprlandDocument());

        assertEquals(DistroBase.ARCH, spec.base());
        assertEquals(InitSystem.SYSTEMD, spec.init());
        assertEquals(Architecture.X86_64, spec.architecture());
        assertEquals("hyprland", spec.display().compositor());
        assertEquals(List.of("git", "neovim"), spec.packages().get(PackageCategory.DEV));
        assertEquals(List.of(), spec.packages().get(PackageCategory.MEDIA));
        assertEquals(10, spec.defaults().swappiness());
        assertTrue(spec.defaults().dnsOverHttps());
    }

    @Test
    void missingDisplayMeansHeadless() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setDisplay(null);

        assertTrue(validator.validate(document).display().isHeadless());
    }

    @Test
    void optionalDefaultsAreFilledIn() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        BuildSpecificationDocument.Defaults defaults = new BuildSpecificationDocument.Defaults();
        defaults.setSwappiness(60);
        document.setDefaults(defaults);

        BuildSpecification spec = validator.validate(document);

        assertTrue(spec.defaults().trim());
        assertFalse(spec.defaults().dnsOverHttps());
        assertFalse(spec.defaults().macRandomization());
        assertNull(spec.defaults().kernelParams());
    }

    @Test
    void rejectsUnsupportedArchitecture() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setArchitecture("riscv64");

        InvalidBuildSpecificationException e = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document));

        assertEquals(List.of("architecture: unsupported value 'riscv64'"), e.getViolations());
        assertEquals("VALIDATION_ERR", e.getErrorCode());
    }

    @Test
    void reportsEveryViolationAtOnce() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setBase("gentoo");
        document.setKernel(" ");
        document.getDefaults().setSwappiness(150);
        document.setPackages(Map.of("games", List.of("nethack")));

        List<String> violations = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document)).getViolations();

        assertEquals(4, violations.size(), violations.toString());
        assertTrue(violations.contains("base: unsupported value 'gentoo'"));
        assertTrue(violations.contains("packages: unknown category 'games'"));
        assertTrue(violations.stream().anyMatch(v -> v.startsWith("kernel: ")));
        assertTrue(violations.stream().anyMatch(v -> v.startsWith("defaults.swappiness: ")));
    }

    @Test
    void rejectsMissingDefaults() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setDefaults(null);

        List<String> violations = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document)).getViolations();

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("defaults: "));
    }

    @Test
    void rejectsInitSystemNotShippedByBase() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setBase("alpine");

        List<String> violations = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document)).getViolations();

        assertEquals(List.of("init: systemd is not available on alpine"), violations);
    }

    @Test
    void rejectsPackageNamesThatCouldEscapeAShell() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setPackages(Map.of("utils", List.of("curl", "vim; rm -rf /")));

        List<String> violations = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document)).getViolations();

        assertEquals(List.of("packages.utils: invalid package name 'vim; rm -rf /'"), violations);
    }

    @Test
    void rejectsCompositorOnWrongDisplayServer() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.getDisplay().setCompositor("sway");
        document.getDisplay().setServer("xorg");

        List<String> violations = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document)).getViolations();

        assertEquals(List.of("display.server: sway requires wayland"), violations);
    }

    @Test
    void rejectsNullDocument() {
        InvalidBuildSpecificationException e = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(null));

        assertEquals(List.of("specification: must not be null"), e.getViolations());
    }

    @Test
    void nullOrBlankSecurityFeatureIsRejected() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setSecurityFeatures(Arrays.asList("firewall", null, " "));

        InvalidBuildSpecificationException e = assertThrows(InvalidBuildSpecificationException.class,
                () -> validator.validate(document));

        assertEquals(List.of("securityFeatures[1]: must not be blank", "securityFeatures[2]: must not be blank"),
                e.getViolations());
    }

    @Test
    void securityFeaturesAreTrimmed() {
        BuildSpecificationDocument document = BuildSpecifications.archHyprlandDocument();
        document.setSecurityFeatures(List.of(" firewall "));

        assertEquals(List.of("firewall"), validator.validate(document).securityFeatures());
    }
}
