package fr.imt.distroforge.distroforge.business.stage;

/**
 * One unit of work of the build pipeline.
 */
public interface PipelineStage {

    StageType type();

    /**
     * Run the stage. Stages may stream log lines and stage artifacts through the context;
     * staged artifacts are only committed when the returned result is ok.
     */
    StageResult run(StageContext context) throws Exception;

    /**
     * Free what the stage holds outside the build workspace. Called once per build after
     * the last stage, whatever the outcome, including for stages that never ran.
     */
    default void release(StageContext context) {
    }
}
