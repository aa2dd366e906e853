package com.mailbridge.smtpapp.pipeline;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs stages in order, feeding each the context returned by the previous one, and stops at
 * the first failure.
 */
public class ProcedurePipeline {

    private static final Logger log = LoggerFactory.getLogger(ProcedurePipeline.class);

    private final List<ProcedureStage> stages;

    public ProcedurePipeline(List<ProcedureStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages must not be empty");
        }
        this.stages = List.copyOf(stages);
    }

    public StageResult run(ProcedureContext initial) {
        ProcedureContext context = initial;
        for (ProcedureStage stage : stages) {
            StageResult result = stage.apply(context);
            if (result.isFailure()) {
                log.debug("Stage {} refused {}: {}", stage.name(), context, result.failure());
                return result;
            }
            context = result.context();
        }
        return StageResult.proceed(context);
    }

    /**
     * Like {@link #run}, for callers that treat a refusal as an exception.
     *
     * @throws ProcedureRejectedException if a stage refuses the request
     */
    public ProcedureContext runOrThrow(ProcedureContext initial) {
        StageResult result = run(initial);
        if (result.isFailure()) {
            throw new ProcedureRejectedException(result.failure());
        }
        return result.context();
    }

    public List<ProcedureStage> stages() {
        return stages;
    }
}
