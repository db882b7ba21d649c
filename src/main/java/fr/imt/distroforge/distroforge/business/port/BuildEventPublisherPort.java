package fr.imt.distroforge.distroforge.business.port;

import fr.imt.distroforge.distroforge.business.model.BuildStatus;

/**
 * Fan-out of build progress to live subscribers. Publishing never fails the build.
 */
public interface BuildEventPublisherPort {

    void publishLog(String buildId, String message);

    void publishStatus(String buildId, BuildStatus status, String currentStage);
}
