package fr.imt.distroforge.distroforge.infrastructure.toolchain;

import fr.imt.distroforge.distroforge.business.model.DistroBase;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Abstract package names and their distribution-specific counterparts.
 * A null entry marks a package that is not packaged for that distribution.
 */
@Component
public class PackageCatalog {

    private final Map<String, Map<DistroBase, String>> entries = new HashMap<>();

    public PackageCatalog() {
        // containers
        add("docker", "docker", "docker.io", "docker.io", "docker");
        add("podman", "podman", "podman", "podman", "podman");
        add("kubernetes", "kubectl", "kubectl", "kubectl", "kubectl");
        add("k3s", "k3s-bin", null, null, null);

        // languages
        add("python", "python", "python3", "python3", "python3");
        add("pip", "python-pip", "python3-pip", "python3-pip", "py3-pip");
        add("nodejs", "nodejs", "nodejs", "nodejs", "nodejs");
        add("npm", "npm", "npm", "npm", "npm");
        add("rust", "rust", "rustc", "rustc", "rust");
        add("go", "go", "golang", "golang", "go");
        add("java", "jdk-openjdk", "default-jdk", "default-jdk", "openjdk17");
        add("ruby", "ruby", "ruby", "ruby", "ruby");

        // editors
        add("neovim", "neovim", "neovim", "neovim", "neovim");
        add("vim", "vim", "vim", "vim", "vim");
        add("emacs", "emacs", "emacs", "emacs", "emacs");
        add("vscode", "code", null, null, null);
        add("vscodium", "vscodium-bin", null, null, null);

        // version control
        add("git", "git", "git", "git", "git");
        add("delta", "git-delta", null, null, null);

        // machine learning
        add("cuda", "cuda", "nvidia-cuda-toolkit", "nvidia-cuda-toolkit", null);
        add("pytorch", "python-pytorch-cuda", "python3-torch", "python3-torch", null);
        add("tensorflow", "python-tensorflow", null, null, null);
        add("ollama", "ollama", null, null, null);
        add("jupyter", "jupyterlab", "jupyter", "jupyter", null);

        // security
        add("apparmor", "apparmor", "apparmor", "apparmor", null);
        add("selinux", null, "selinux-basics", "selinux-basics", null);
        add("nftables", "nftables", "nftables", "nftables", "nftables");
        add("iptables", "iptables", "iptables", "iptables", "iptables");
        add("ufw", "ufw", "ufw", "ufw", null);
        add("fail2ban", "fail2ban", "fail2ban", "fail2ban", "fail2ban");

        // networking
        add("networkmanager", "networkmanager", "network-manager", "network-manager", "networkmanager");
        add("wireguard", "wireguard-tools", "wireguard", "wireguard", "wireguard-tools");
        add("openvpn", "openvpn", "openvpn", "openvpn", "openvpn");
        add("tailscale", "tailscale", null, null, "tailscale");
        add("dnscrypt-proxy", "dnscrypt-proxy", "dnscrypt-proxy", "dnscrypt-proxy", "dnscrypt-proxy");

        // databases
        add("postgresql", "postgresql", "postgresql", "postgresql", "postgresql");
        add("mysql", "mysql", "mysql-server", "mysql-server", "mysql");
        add("mariadb", "mariadb", "mariadb-server", "mariadb-server", "mariadb");
        add("redis", "redis", "redis-server", "redis-server", "redis");
        add("mongodb", "mongodb-bin", null, null, null);
        add("sqlite", "sqlite", "sqlite3", "sqlite3", "sqlite");

        // servers
        add("nginx", "nginx", "nginx", "nginx", "nginx");
        add("apache", "apache", "apache2", "apache2", "apache2");
        add("caddy", "caddy", null, null, "caddy");

        // multimedia
        add("ffmpeg", "ffmpeg", "ffmpeg", "ffmpeg", "ffmpeg");
        add("pipewire", "pipewire", "pipewire", "pipewire", "pipewire");
        add("pulseaudio", "pulseaudio", "pulseaudio", "pulseaudio", "pulseaudio");
        add("gstreamer", "gstreamer", "gstreamer1.0-tools", "gstreamer1.0-tools", "gstreamer");

        // shells
        add("zsh", "zsh", "zsh", "zsh", "zsh");
        add("fish", "fish", "fish", "fish", "fish");

        // monitoring and backup
        add("prometheus", "prometheus", "prometheus", "prometheus", "prometheus");
        add("grafana", "grafana", "grafana", "grafana", null);
        add("netdata", "netdata", "netdata", "netdata", "netdata");
        add("borg", "borg", "borgbackup", "borgbackup", "borgbackup");
        add("restic", "restic", "restic", "restic", "restic");

        // utilities
        add("yay", "yay", null, null, null);
        add("flatpak", "flatpak", "flatpak", "flatpak", "flatpak");
        add("curl", "curl", "curl", "curl", "curl");
        add("wget", "wget", "wget", "wget", "wget");
        add("htop", "htop", "htop", "htop", "htop");
        add("neofetch", "neofetch", "neofetch", "neofetch", "neofetch");

        // browsers
        add("firefox", "firefox", "firefox-esr", "firefox", "firefox");
        add("chromium", "chromium", "chromium", "chromium-browser", "chromium");

        // display
        add("hyprland", "hyprland", null, null, null);
        add("sway", "sway", "sway", "sway", "sway");
        add("i3", "i3-wm", "i3", "i3", "i3wm");
        add("waybar", "waybar", "waybar", "waybar", "waybar");
        add("polybar", "polybar", "polybar", "polybar", null);
        add("rofi", "rofi", "rofi", "rofi", "rofi");
        add("wofi", "wofi", "wofi", "wofi", "wofi");
        add("kitty", "kitty", "kitty", "kitty", "kitty");
        add("alacritty", "alacritty", "alacritty", "alacritty", "alacritty");
        add("foot", "foot", "foot", "foot", "foot");
        add("mako", "mako", "mako-notifier", "mako-notifier", "mako");
        add("dunst", "dunst", "dunst", "dunst", "dunst");
        add("swaylock", "swaylock", "swaylock", "swaylock", "swaylock");
        add("hyprlock", "hyprlock", null, null, null);
    }

    /**
     * @return the distribution package, the name itself for packages outside the catalog,
     * or empty if the package is known but not available on the distribution
     */
    public Optional<String> lookup(String name, DistroBase distro) {
        Map<DistroBase, String> entry = entries.get(name.toLowerCase(Locale.ROOT));
        return entry == null ? Optional.of(name) : Optional.ofNullable(entry.get(distro));
    }

    private void add(String name, String arch, String debian, String ubuntu, String alpine) {
        Map<DistroBase, String> entry = new EnumMap<>(DistroBase.class);
        entry.put(DistroBase.ARCH, arch);
        entry.put(DistroBase.DEBIAN, debian);
        entry.put(DistroBase.UBUNTU, ubuntu);
        entry.put(DistroBase.ALPINE, alpine);
        entries.put(name, entry);
    }
}
