package fr.imt.distroforge.distroforge.business.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw specification document as submitted by a client, before validation.
 * Enumerated values are kept as strings so that unsupported values are reported
 * by the validator instead of failing deserialization.
 */
@Data
public class BuildSpecificationDocument {

    @NotBlank
    private String base;

    @NotBlank
    private String kernel;

    @NotBlank
    private String init;

    @NotBlank
    private String architecture;

    @Valid
    private Display display;

    @NotNull
    private Map<String, List<String>> packages;

    private List<String> securityFeatures;

    @Valid
    @NotNull
    private Defaults defaults;

    @Data
    public static class Display {
        private String server;
        private String compositor;
        private String bar;
        private String launcher;
        private String terminal;
        private String notifications;
        private String lockscreen;
    }

    @Data
    public static class Defaults {

        @NotNull
        @Min(0)
        @Max(100)
        private Integer swappiness;

        private Boolean trim;

        private String kernelParams;

        private Boolean dnsOverHttps;

        private Boolean macRandomization;
    }
}
