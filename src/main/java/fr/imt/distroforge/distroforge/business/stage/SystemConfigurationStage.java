package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.InitSystem;
import fr.imt.distroforge.distroforge.business.model.SystemDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders the system overlay: sysctl, kernel command line, services and the security features
 * that translate into configuration files.
 */
@Component
@Slf4j
public class SystemConfigurationStage implements PipelineStage {

    static final String SYSCTL_FILE = "etc/sysctl.d/99-distroforge.conf";
    static final String CMDLINE_FILE = "etc/kernel/cmdline";
    static final String BUILD_CONF_FILE = "etc/distroforge/build.conf";
    static final String FSTRIM_PERIODIC_FILE = "etc/periodic/weekly/fstrim";
    static final String DNSCRYPT_FILE = "etc/dnscrypt-proxy/dnscrypt-proxy.toml";
    static final String RESOLV_CONF_FILE = "etc/resolv.conf";
    static final String MAC_RANDOMIZATION_FILE = "etc/NetworkManager/conf.d/00-macrandomize.conf";
    static final String NFTABLES_FILE = "etc/nftables.conf";
    static final String FAIL2BAN_FILE = "etc/fail2ban/jail.local";
    static final String SSHD_FILE = "etc/ssh/sshd_config.d/10-distroforge.conf";

    @Override
    public StageType type() {
        return StageType.SYSTEM_CONFIGURATION;
    }

    @Override
    public StageResult run(StageContext context) throws IOException {
        BuildSpecification spec = context.getSpec();
        SystemDefaults defaults = spec.defaults();
        InitSystem init = spec.init();
        Path overlay = context.overlayDir();

        List<String> lines = new ArrayList<>();
        Set<String> services = new LinkedHashSet<>();
        List<String> cmdline = new ArrayList<>();
        List<String> sysctl = new ArrayList<>();

        sysctl.add("vm.swappiness = " + defaults.swappiness());
        if (defaults.kernelParams() != null) {
            cmdline.add(defaults.kernelParams());
        }

        if (defaults.trim()) {
            if (init == InitSystem.SYSTEMD) {
                services.add("fstrim.timer");
            } else {
                OverlayFiles.write(overlay, FSTRIM_PERIODIC_FILE, "#!/bin/sh\nfstrim -av\n");
            }
            lines.add("Periodic TRIM enabled");
        }

        if (defaults.dnsOverHttps()) {
            OverlayFiles.write(overlay, DNSCRYPT_FILE, """
                    listen_addresses = ['127.0.0.1:53']
                    server_names = ['cloudflare', 'quad9-doh-ip4-port443-filter-pri']
                    doh_servers = true
                    require_dnssec = true
                    require_nolog = true
                    """);
            OverlayFiles.write(overlay, RESOLV_CONF_FILE, "nameserver 127.0.0.1\noptions edns0\n");
            services.add("dnscrypt-proxy");
            lines.add("DNS-over-HTTPS resolver configured");
        }

        if (defaults.macRandomization()) {
            OverlayFiles.write(overlay, MAC_RANDOMIZATION_FILE, """
                    [device-mac-randomization]
                    wifi.scan-rand-mac-address=yes

                    [connection-mac-randomization]
                    ethernet.cloned-mac-address=random
                    wifi.cloned-mac-address=random
                    """);
            services.add(InitServices.networkManagerService(init));
            lines.add("MAC address randomization configured");
        }

        for (String feature : spec.securityFeatures()) {
            lines.add(applySecurityFeature(feature, overlay, services, cmdline, sysctl));
        }

        OverlayFiles.write(overlay, SYSCTL_FILE, String.join("\n", sysctl) + "\n");
        if (!cmdline.isEmpty()) {
            OverlayFiles.write(overlay, CMDLINE_FILE, String.join(" ", cmdline) + "\n");
            lines.add("Kernel command line: " + String.join(" ", cmdline));
        }
        if (!services.isEmpty()) {
            OverlayFiles.write(overlay, InitServices.ENABLE_SCRIPT, InitServices.enableScript(List.copyOf(services), init));
            lines.add("Services enabled with " + init.getValue() + ": " + String.join(", ", services));
        }
        OverlayFiles.write(overlay, BUILD_CONF_FILE, buildConf(context));

        lines.add("System overlay rendered (swappiness " + defaults.swappiness() + ")");
        return StageResult.success(lines);
    }

    private String applySecurityFeature(String feature, Path overlay, Set<String> services,
                                        List<String> cmdline, List<String> sysctl) throws IOException {
        String key = feature.toLowerCase(Locale.ROOT);
        List<String> applied = new ArrayList<>();

        if (key.contains("apparmor")) {
            cmdline.add("apparmor=1 security=apparmor");
            services.add("apparmor");
            applied.add("apparmor");
        }
        if (key.contains("firewall")) {
            OverlayFiles.write(overlay, NFTABLES_FILE, """
                    #!/usr/sbin/nft -f
                    flush ruleset
                    table inet filter {
                      chain input {
                        type filter hook input priority 0; policy drop;
                        ct state established,related accept
                        iif lo accept
                      }
                    }
                    """);
            services.add("nftables");
            applied.add("nftables");
        }
        if (key.contains("fail2ban")) {
            OverlayFiles.write(overlay, FAIL2BAN_FILE, """
                    [DEFAULT]
                    bantime = 10m
                    maxretry = 5

                    [sshd]
                    enabled = true
                    """);
            services.add("fail2ban");
            applied.add("fail2ban");
        }
        if (key.contains("ssh")) {
            OverlayFiles.write(overlay, SSHD_FILE, """
                    PermitRootLogin prohibit-password
                    PasswordAuthentication no
                    PubkeyAuthentication yes
                    MaxAuthTries 3
                    """);
            applied.add("sshd");
        }
        if (key.contains("harden")) {
            sysctl.add("kernel.randomize_va_space = 2");
            sysctl.add("kernel.kptr_restrict = 2");
            sysctl.add("kernel.dmesg_restrict = 1");
            sysctl.add("net.ipv4.tcp_syncookies = 1");
            applied.add("sysctl");
        }

        if (!applied.isEmpty()) {
            return "Security feature '" + feature + "' applied (" + String.join(", ", applied) + ")";
        }
        if (key.contains("luks") || key.contains("encrypt") || key.contains("secure boot")) {
            return "Security feature '" + feature + "' is set up at install time, nothing to render";
        }
        log.debug("No overlay mapping for security feature {}", feature);
        return "Security feature '" + feature + "' has no overlay mapping, skipped";
    }

    private String buildConf(StageContext context) {
        BuildSpecification spec = context.getSpec();
        return String.join("\n",
                "BUILD_ID=" + context.getBuildId(),
                "BASE=" + spec.base().getValue(),
                "KERNEL=" + spec.kernel(),
                "INIT=" + spec.init().getValue(),
                "ARCHITECTURE=" + spec.architecture().getValue()) + "\n";
    }
}
