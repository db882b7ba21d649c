package fr.imt.distroforge.distroforge.infrastructure.toolchain;

import fr.imt.distroforge.distroforge.business.model.DistroBase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Generates the Dockerfile that bootstraps the base root filesystem of a build.
 */
@Component
public class RootfsDockerfileGenerator {

    /**
     * Packages that are not installed through the package manager.
     */
    private static final Map<String, List<String>> SPECIAL_PACKAGE_HANDLERS = Map.of(
            "oh-my-zsh", List.of(
                    "RUN git clone --depth=1 https://github.com/ohmyzsh/ohmyzsh.git /opt/oh-my-zsh",
                    "RUN ln -s /opt/oh-my-zsh /usr/share/oh-my-zsh || true")
    );

    public String generate(DistroBase base, List<String> packages) {
        List<String> installable = new ArrayList<>();
        List<String> specialCommands = new ArrayList<>();
        for (String pkg : packages) {
            List<String> handler = SPECIAL_PACKAGE_HANDLERS.get(pkg);
            if (handler != null) {
                specialCommands.addAll(handler);
            } else {
                installable.add(pkg);
            }
        }
        if (!specialCommands.isEmpty() && !installable.contains("git")) {
            installable.add("git");
        }

        List<String> lines = switch (base) {
            case ARCH -> arch(installable);
            case DEBIAN -> apt("debian:bookworm", installable);
            case UBUNTU -> apt("ubuntu:noble", installable);
            case ALPINE -> alpine(installable);
        };
        lines.addAll(specialCommands);
        lines.add("LABEL distroforge.base=\"" + base.getValue() + "\"");
        return String.join("\n", lines) + "\n";
    }

    private List<String> arch(List<String> packages) {
        List<String> lines = new ArrayList<>();
        lines.add("FROM archlinux:latest");
        lines.add("RUN pacman-key --init && pacman-key --populate archlinux");
        lines.add("RUN pacman -Sy --noconfirm reflector && reflector --latest 5 --sort rate --save /etc/pacman.d/mirrorlist");
        if (packages.isEmpty()) {
            lines.add("RUN pacman -Syu --noconfirm");
        } else {
            lines.add("RUN pacman -Syu --noconfirm && pacman -S --noconfirm --needed " + String.join(" ", packages));
        }
        return lines;
    }

    private List<String> apt(String image, List<String> packages) {
        List<String> lines = new ArrayList<>();
        lines.add("FROM " + image);
        lines.add("ENV DEBIAN_FRONTEND=noninteractive");
        if (packages.isEmpty()) {
            lines.add("RUN apt-get update");
        } else {
            lines.add("RUN apt-get update && apt-get install -y --no-install-recommends " + String.join(" ", packages)
                    + " && rm -rf /var/lib/apt/lists/*");
        }
        return lines;
    }

    private List<String> alpine(List<String> packages) {
        List<String> lines = new ArrayList<>();
        lines.add("FROM alpine:latest");
        if (!packages.isEmpty()) {
            lines.add("RUN apk add --no-cache " + String.join(" ", packages));
        }
        return lines;
    }
}
