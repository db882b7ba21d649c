package fr.imt.distroforge.distroforge.business.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum Architecture {
    X86_64("x86_64", "linux/amd64"),
    AARCH64("aarch64", "linux/arm64");

    private final String value;
    private final String dockerPlatform;

    Architecture(String value, String dockerPlatform) {
        this.value = value;
        this.dockerPlatform = dockerPlatform;
    }

    public static Optional<Architecture> fromValue(String value) {
        return Arrays.stream(values())
                .filter(arch -> arch.value.equals(value))
                .findFirst();
    }
}
