package fr.imt.distroforge.distroforge.business.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

@Getter
public enum DistroBase {
    ARCH("arch", Set.of(InitSystem.SYSTEMD, InitSystem.OPENRC, InitSystem.RUNIT, InitSystem.S6)),
    DEBIAN("debian", Set.of(InitSystem.SYSTEMD, InitSystem.OPENRC)),
    UBUNTU("ubuntu", Set.of(InitSystem.SYSTEMD)),
    ALPINE("alpine", Set.of(InitSystem.OPENRC));

    private final String value;
    private final Set<InitSystem> supportedInitSystems;

    DistroBase(String value, Set<InitSystem> supportedInitSystems) {
        this.value = value;
        this.supportedInitSystems = supportedInitSystems;
    }

    public boolean supports(InitSystem init) {
        return supportedInitSystems.contains(init);
    }

    public static Optional<DistroBase> fromValue(String value) {
        return Arrays.stream(values())
                .filter(base -> base.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
