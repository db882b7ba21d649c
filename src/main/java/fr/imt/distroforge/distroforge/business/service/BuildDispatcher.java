package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildSpecificationDocument;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.port.BuildEventPublisherPort;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.configuration.BuildExecutorConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Accepts build requests and launches one pipeline execution per accepted build
 * without blocking the caller.
 */
@Service
@Slf4j
public class BuildDispatcher {

    private final BuildSpecificationValidator validator;
    private final BuildRecordStore buildRecordStore;
    private final BuildLogAggregator logAggregator;
    private final PipelineExecutor pipelineExecutor;
    private final BuildEventPublisherPort eventPublisher;
    private final Executor buildTaskExecutor;

    private final ConcurrentMap<String, CompletableFuture<BuildStatus>> executions = new ConcurrentHashMap<>();

    public BuildDispatcher(BuildSpecificationValidator validator,
                           BuildRecordStore buildRecordStore,
                           BuildLogAggregator logAggregator,
                           PipelineExecutor pipelineExecutor,
                           BuildEventPublisherPort eventPublisher,
                           @Qualifier(BuildExecutorConfiguration.BUILD_TASK_EXECUTOR) Executor buildTaskExecutor) {
        this.validator = validator;
        this.buildRecordStore = buildRecordStore;
        this.logAggregator = logAggregator;
        this.pipelineExecutor = pipelineExecutor;
        this.eventPublisher = eventPublisher;
        this.buildTaskExecutor = buildTaskExecutor;
    }

    /**
     * Validate the document, create a PENDING build and schedule its pipeline.
     *
     * @return the identifier of the new build
     */
    public String submit(BuildSpecificationDocument document) {
        BuildSpecification spec = validator.validate(document);
        String buildId = buildRecordStore.create(spec);
        eventPublisher.publishStatus(buildId, BuildStatus.PENDING, null);
        logAggregator.append(buildId, "Build queued for " + spec.base().getValue() + " on " + spec.architecture().getValue());

        try {
            CompletableFuture<BuildStatus> execution = CompletableFuture.supplyAsync(
                    () -> pipelineExecutor.execute(buildId), buildTaskExecutor);
            executions.put(buildId, execution);
            execution.whenComplete((status, error) -> {
                if (error != null) {
                    log.error("Execution of build {} ended abnormally", buildId, error);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Build {} could not be scheduled", buildId, e);
            logAggregator.append(buildId, "Build could not be scheduled: " + e.getMessage());
            buildRecordStore.setStatus(buildId, BuildStatus.FAILURE);
            eventPublisher.publishStatus(buildId, BuildStatus.FAILURE, null);
            executions.put(buildId, CompletableFuture.completedFuture(BuildStatus.FAILURE));
        }

        log.info("Build {} accepted", buildId);
        return buildId;
    }

    /**
     * The pipeline execution of a build accepted by this dispatcher.
     */
    public Optional<CompletableFuture<BuildStatus>> execution(String buildId) {
        return Optional.ofNullable(executions.get(buildId));
    }

    void forget(String buildId) {
        executions.remove(buildId);
    }
}
