package fr.imt.distroforge.distroforge.business.model;

public record SystemDefaults(
        int swappiness,
        boolean trim,
        String kernelParams,
        boolean dnsOverHttps,
        boolean macRandomization) {
}
