package fr.imt.distroforge.distroforge.business.port;

/**
 * Receives log lines of a running build as they are produced.
 */
@FunctionalInterface
public interface BuildLogSink {

    void log(String message);
}
