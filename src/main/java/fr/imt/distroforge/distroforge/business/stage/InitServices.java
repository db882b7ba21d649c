package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.InitSystem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service enablement commands per init system.
 */
final class InitServices {

    static final String ENABLE_SCRIPT = "etc/distroforge/enable-services.sh";

    private InitServices() {
    }

    static String enableCommand(String service, InitSystem init) {
        return switch (init) {
            case SYSTEMD -> "systemctl enable " + service;
            case OPENRC -> "rc-update add " + service + " default";
            case RUNIT -> "ln -sf /etc/sv/" + service + " /var/service/";
            case S6 -> "s6-rc-bundle-update add default " + service;
        };
    }

    static String enableScript(List<String> services, InitSystem init) {
        return "#!/bin/sh\nset -e\n" + services.stream()
                .map(service -> enableCommand(service, init))
                .collect(Collectors.joining("\n", "", "\n"));
    }

    static String networkManagerService(InitSystem init) {
        return init == InitSystem.SYSTEMD ? "NetworkManager" : "networkmanager";
    }
}
