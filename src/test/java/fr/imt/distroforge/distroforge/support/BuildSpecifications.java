package fr.imt.distroforge.distroforge.support;

import fr.imt.distroforge.distroforge.business.model.Architecture;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildSpecificationDocument;
import fr.imt.distroforge.distroforge.business.model.DisplayStack;
import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.InitSystem;
import fr.imt.distroforge.distroforge.business.model.PackageCategory;
import fr.imt.distroforge.distroforge.business.model.SystemDefaults;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Specification fixtures shared by the tests.
 */
public final class BuildSpecifications {

    private BuildSpecifications() {
    }

    /**
     * A valid arch + hyprland document.
     */
    public static BuildSpecificationDocument archHyprlandDocument() {
        BuildSpecificationDocument document = new BuildSpecificationDocument();
        document.setBase("arch");
        document.setKernel("linux-zen");
        document.setInit("systemd");
        document.setArchitecture("x86_64");

        BuildSpecificationDocument.Display display = new BuildSpecificationDocument.Display();
        display.setServer("wayland");
        display.setCompositor("hyprland");
        display.setBar("waybar");
        display.setLauncher("wofi");
        display.setTerminal("kitty");
        display.setNotifications("mako");
        display.setLockscreen("hyprlock");
        document.setDisplay(display);

        Map<String, List<String>> packages = new LinkedHashMap<>();
        packages.put("system", List.of("networkmanager"));
        packages.put("dev", List.of("git", "neovim"));
        document.setPackages(packages);
        document.setSecurityFeatures(List.of("AppArmor profiles"));

        BuildSpecificationDocument.Defaults defaults = new BuildSpecificationDocument.Defaults();
        defaults.setSwappiness(10);
        defaults.setTrim(true);
        defaults.setKernelParams("quiet splash");
        defaults.setDnsOverHttps(true);
        defaults.setMacRandomization(true);
        document.setDefaults(defaults);
        return document;
    }

    public static BuildSpecification archHyprland() {
        return new BuildSpecification(
                DistroBase.ARCH,
                "linux-zen",
                InitSystem.SYSTEMD,
                Architecture.X86_64,
                new DisplayStack("wayland", "hyprland", "waybar", "wofi", "kitty", "mako", "hyprlock"),
                Map.of(PackageCategory.SYSTEM, List.of("networkmanager"),
                        PackageCategory.DEV, List.of("git", "neovim")),
                List.of("AppArmor profiles"),
                new SystemDefaults(10, true, "quiet splash", true, true));
    }

    public static BuildSpecification headlessAlpine() {
        return new BuildSpecification(
                DistroBase.ALPINE,
                "linux-lts",
                InitSystem.OPENRC,
                Architecture.AARCH64,
                null,
                Map.of(PackageCategory.UTILS, List.of("curl")),
                null,
                new SystemDefaults(60, true, null, false, false));
    }
}
