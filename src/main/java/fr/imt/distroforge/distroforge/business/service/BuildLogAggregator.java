package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.port.BuildEventPublisherPort;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.business.utils.LogMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point for build log lines. Lines are masked, stored in order and fanned out to subscribers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BuildLogAggregator {

    private final BuildRecordStore buildRecordStore;
    private final BuildEventPublisherPort eventPublisher;

    public void append(String buildId, String message) {
        if (message == null) {
            return;
        }
        for (String line : LogMasker.mask(message).split("\\R")) {
            String trimmed = line.stripTrailing();
            if (trimmed.isBlank()) {
                continue;
            }
            log.info("[{}] {}", buildId, trimmed);
            buildRecordStore.appendLog(buildId, trimmed);
            eventPublisher.publishLog(buildId, trimmed);
        }
    }

    public BuildLogSink sink(String buildId) {
        return message -> append(buildId, message);
    }
}
