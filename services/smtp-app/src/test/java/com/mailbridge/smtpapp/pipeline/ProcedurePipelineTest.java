package com.mailbridge.smtpapp.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProcedurePipeline")
class ProcedurePipelineTest {

    private final List<String> calls = new ArrayList<>();

    private ProcedureStage recording(String name) {
        return context -> {
            calls.add(name);
            return StageResult.proceed(context);
        };
    }

    private ProcedureStage refusing(String name, FailureKind kind) {
        return context -> {
            calls.add(name);
            return StageResult.fail(kind, name + " refused");
        };
    }

    @Test
    @DisplayName("runs every stage in declaration order")
    void runsStagesInOrder() {
        ProcedurePipeline pipeline =
                new ProcedurePipeline(List.of(recording("a"), recording("b"), recording("c")));

        StageResult result = pipeline.run(ProcedureContext.serverOriginated("https://t/graphql/", "app"));

        assertThat(result.isFailure()).isFalse();
        assertThat(calls).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("feeds each stage the context produced by the previous one")
    void threadsContext() {
        ProcedureStage addPermission = context -> StageResult.proceed(new ProcedureContext(
                context.rawToken(), context.claimedTenantApiUrl(), "rewritten", context.serverOriginated(),
                context.requiredPermissions(), null, null, null));
        ProcedureStage check = context -> context.claimedAppId().equals("rewritten")
                ? StageResult.proceed(context)
                : StageResult.fail(FailureKind.INTERNAL, "context not threaded");

        StageResult result = new ProcedurePipeline(List.of(addPermission, check))
                .run(ProcedureContext.serverOriginated("https://t/graphql/", "original"));

        assertThat(result.isFailure()).isFalse();
        assertThat(result.context().claimedAppId()).isEqualTo("rewritten");
    }

    @Test
    @DisplayName("stops at the first failure without running later stages")
    void shortCircuits() {
        ProcedurePipeline pipeline = new ProcedurePipeline(
                List.of(recording("a"), refusing("b", FailureKind.UNAUTHENTICATED), recording("c")));

        StageResult result = pipeline.run(ProcedureContext.serverOriginated("https://t/graphql/", "app"));

        assertThat(result.failure()).isEqualTo(new ProcedureFailure(FailureKind.UNAUTHENTICATED, "b refused"));
        assertThat(calls).containsExactly("a", "b");
    }

    @Test
    @DisplayName("runOrThrow raises the failure as ProcedureRejectedException")
    void runOrThrowRaises() {
        ProcedurePipeline pipeline =
                new ProcedurePipeline(List.of(refusing("only", FailureKind.AUTHORIZATION_DENIED)));

        assertThatThrownBy(() -> pipeline.runOrThrow(ProcedureContext.serverOriginated("https://t/graphql/", "app")))
                .isInstanceOf(ProcedureRejectedException.class)
                .satisfies(e -> assertThat(((ProcedureRejectedException) e).failure().kind())
                        .isEqualTo(FailureKind.AUTHORIZATION_DENIED));
    }

    @Test
    @DisplayName("rejects an empty stage list")
    void rejectsEmptyPipeline() {
        assertThatThrownBy(() -> new ProcedurePipeline(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a stage result holds exactly one of context and failure")
    void stageResultIsExclusive() {
        assertThatThrownBy(() -> new StageResult(null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
