package fr.imt.distroforge.distroforge.business.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum PackageCategory {
    SYSTEM("system"),
    DEV("dev"),
    SECURITY("security"),
    UTILS("utils"),
    MEDIA("media"),
    BROWSERS("browsers");

    private final String value;

    PackageCategory(String value) {
        this.value = value;
    }

    public static Optional<PackageCategory> fromValue(String value) {
        return Arrays.stream(values())
                .filter(category -> category.value.equals(value))
                .findFirst();
    }
}
