package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.DisplayStack;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the display session overlay. Headless builds skip it.
 */
@Component
public class DisplayConfigurationStage implements PipelineStage {

    static final String DISPLAY_CONF_FILE = "etc/distroforge/display.conf";
    static final String SWAY_FILE = "etc/sway/config.d/50-distroforge.conf";
    static final String HYPRLAND_FILE = "etc/skel/.config/hypr/hyprland.conf";
    static final String I3_FILE = "etc/skel/.config/i3/config";

    private static final Map<String, String> LAUNCHER_COMMANDS = Map.of(
            "rofi", "rofi -show drun",
            "wofi", "wofi --show drun",
            "fuzzel", "fuzzel",
            "dmenu", "dmenu_run"
    );

    private static final Map<String, String> LOCKSCREEN_COMMANDS = Map.of(
            "swaylock", "swaylock -f",
            "hyprlock", "hyprlock",
            "i3lock", "i3lock -c 000000"
    );

    @Override
    public StageType type() {
        return StageType.DISPLAY_CONFIGURATION;
    }

    @Override
    public StageResult run(StageContext context) throws IOException {
        DisplayStack display = context.getSpec().display();
        if (display.isHeadless()) {
            return StageResult.success("No display stack requested, skipping display configuration");
        }

        Path overlay = context.overlayDir();
        List<String> lines = new ArrayList<>();
        OverlayFiles.write(overlay, DISPLAY_CONF_FILE, displayConf(display));

        String compositor = display.compositor() != null ? display.compositor().toLowerCase(Locale.ROOT) : null;
        if ("sway".equals(compositor)) {
            OverlayFiles.write(overlay, SWAY_FILE, swayConfig(display));
            lines.add("Sway session configured");
        } else if ("hyprland".equals(compositor)) {
            OverlayFiles.write(overlay, HYPRLAND_FILE, hyprlandConfig(display));
            lines.add("Hyprland session configured");
        } else if ("i3".equals(compositor)) {
            OverlayFiles.write(overlay, I3_FILE, i3Config(display));
            lines.add("i3 session configured");
        } else if (compositor != null) {
            lines.add("No session template for compositor '" + display.compositor() + "', wrote display.conf only");
        }

        lines.add("Display components: " + String.join(", ", display.components()));
        return StageResult.success(lines);
    }

    private String displayConf(DisplayStack display) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("DISPLAY_SERVER", display.server());
        entries.put("COMPOSITOR", display.compositor());
        entries.put("BAR", display.bar());
        entries.put("LAUNCHER", display.launcher());
        entries.put("TERMINAL", display.terminal());
        entries.put("NOTIFICATIONS", display.notifications());
        entries.put("LOCKSCREEN", display.lockscreen());

        StringBuilder conf = new StringBuilder();
        entries.forEach((key, value) -> {
            if (value != null) {
                conf.append(key).append('=').append(value).append('\n');
            }
        });
        return conf.toString();
    }

    private String swayConfig(DisplayStack display) {
        List<String> lines = new ArrayList<>();
        if (display.terminal() != null) {
            lines.add("set $term " + display.terminal());
        }
        if (display.launcher() != null) {
            lines.add("set $menu " + launcherCommand(display.launcher()));
        }
        if (display.bar() != null) {
            lines.add("bar {\n    swaybar_command " + display.bar() + "\n}");
        }
        if (display.notifications() != null) {
            lines.add("exec " + display.notifications());
        }
        if (display.lockscreen() != null) {
            lines.add("bindsym $mod+Escape exec " + lockscreenCommand(display.lockscreen()));
        }
        return String.join("\n", lines) + "\n";
    }

    private String hyprlandConfig(DisplayStack display) {
        List<String> lines = new ArrayList<>();
        if (display.terminal() != null) {
            lines.add("$terminal = " + display.terminal());
            lines.add("bind = SUPER, Return, exec, $terminal");
        }
        if (display.launcher() != null) {
            lines.add("$menu = " + launcherCommand(display.launcher()));
            lines.add("bind = SUPER, D, exec, $menu");
        }
        if (display.bar() != null) {
            lines.add("exec-once = " + display.bar());
        }
        if (display.notifications() != null) {
            lines.add("exec-once = " + display.notifications());
        }
        if (display.lockscreen() != null) {
            lines.add("bind = SUPER, L, exec, " + lockscreenCommand(display.lockscreen()));
        }
        return String.join("\n", lines) + "\n";
    }

    private String i3Config(DisplayStack display) {
        List<String> lines = new ArrayList<>();
        lines.add("set $mod Mod4");
        if (display.terminal() != null) {
            lines.add("bindsym $mod+Return exec " + display.terminal());
        }
        if (display.launcher() != null) {
            lines.add("bindsym $mod+d exec " + launcherCommand(display.launcher()));
        }
        if (display.bar() != null) {
            lines.add("exec_always --no-startup-id " + display.bar());
        }
        if (display.notifications() != null) {
            lines.add("exec --no-startup-id " + display.notifications());
        }
        if (display.lockscreen() != null) {
            lines.add("bindsym $mod+Escape exec " + lockscreenCommand(display.lockscreen()));
        }
        return String.join("\n", lines) + "\n";
    }

    private static String launcherCommand(String launcher) {
        return LAUNCHER_COMMANDS.getOrDefault(launcher.toLowerCase(Locale.ROOT), launcher);
    }

    private static String lockscreenCommand(String lockscreen) {
        return LOCKSCREEN_COMMANDS.getOrDefault(lockscreen.toLowerCase(Locale.ROOT), lockscreen);
    }
}
