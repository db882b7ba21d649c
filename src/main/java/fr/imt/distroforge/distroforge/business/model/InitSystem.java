package fr.imt.distroforge.distroforge.business.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum InitSystem {
    SYSTEMD("systemd"),
    OPENRC("openrc"),
    RUNIT("runit"),
    S6("s6");

    private final String value;

    InitSystem(String value) {
        this.value = value;
    }

    public static Optional<InitSystem> fromValue(String value) {
        return Arrays.stream(values())
                .filter(init -> init.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
