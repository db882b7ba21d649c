package fr.imt.distroforge.distroforge.business.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Chosen display components. Every field is a free-form identifier and may be null.
 */
public record DisplayStack(
        String server,
        String compositor,
        String bar,
        String launcher,
        String terminal,
        String notifications,
        String lockscreen) {

    public static final DisplayStack HEADLESS = new DisplayStack(null, null, null, null, null, null, null);

    public boolean isHeadless() {
        return Stream.of(server, compositor, bar, launcher, terminal, notifications, lockscreen)
                .allMatch(Objects::isNull);
    }

    /**
     * Components that have to be installed, in session start order.
     */
    public List<String> components() {
        List<String> components = new ArrayList<>();
        Stream.of(compositor, bar, launcher, terminal, notifications, lockscreen)
                .filter(Objects::nonNull)
                .forEach(components::add);
        return components;
    }
}
