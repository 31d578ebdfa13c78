package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowledger.model.AttemptResult;
import com.flowledger.model.AttemptStatus;
import com.flowledger.model.ExecutionContext;
import com.flowledger.model.StepTrace;
import com.flowledger.model.step.ConditionStep;
import com.flowledger.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a step graph once, for one attempt.
 *
 * FLOW:
 *   root sequence, left to right
 *        ↓
 *   action step?    → ActionExecutor → ok: next step / error: stop, attempt failed
 *   condition step? → ConditionEvaluator → run exactly one of then / else
 *                                           (same walk, recursively)
 *        ↓
 *   end of root sequence → attempt succeeded
 *
 * Step paths: root steps are "0", "1", ...; a branch child is
 * "<condition path>.then.<i>" or "<condition path>.else.<i>".
 *
 * Fail-fast: the first failing step ends the attempt. Side effects of earlier
 * steps are kept. Any RuntimeException from a step is caught here and turned
 * into "step <path> (<type>) failed: <cause>"; nothing escapes to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionEngine {

    private final ActionExecutor actionExecutor;
    private final ConditionEvaluator conditionEvaluator;
    private final TemplateResolver templateResolver;

    public AttemptResult execute(List<Step> steps, ExecutionContext context) {
        Walk walk = new Walk(context);
        walk.sequence(steps, "");
        if (walk.failedPath != null) {
            return AttemptResult.failed(walk.failedPath, walk.failure, walk.trace);
        }
        return AttemptResult.succeeded(walk.trace);
    }

    static String childPath(String prefix, int index) {
        return prefix.isEmpty() ? String.valueOf(index) : prefix + "." + index;
    }

    static String failureMessage(String stepPath, Step step, RuntimeException e) {
        String cause = e.getMessage() == null || e.getMessage().isBlank()
                ? e.getClass().getSimpleName() : e.getMessage();
        return "step " + stepPath + " (" + step.getType().value() + ") failed: " + cause;
    }

    /** State of one traversal. Discarded after the attempt. */
    private final class Walk {

        private final ExecutionContext context;
        private final List<StepTrace> trace = new ArrayList<>();
        private String failedPath;
        private String failure;

        private Walk(ExecutionContext context) {
            this.context = context;
        }

        /** @return false once a step has failed */
        private boolean sequence(List<Step> steps, String prefix) {
            for (int i = 0; i < steps.size(); i++) {
                if (!step(steps.get(i), childPath(prefix, i))) {
                    return false;
                }
            }
            return true;
        }

        private boolean step(Step step, String path) {
            long started = System.nanoTime();
            if (step instanceof ConditionStep) {
                return condition((ConditionStep) step, path, started);
            }
            try {
                JsonNode detail = actionExecutor.execute(step, path, context);
                record(path, step, AttemptStatus.SUCCEEDED, null, started, detail);
                return true;
            } catch (RuntimeException e) {
                fail(path, step, e, started);
                return false;
            }
        }

        private boolean condition(ConditionStep step, String path, long started) {
            boolean passes;
            try {
                JsonNode comparison = templateResolver.resolve(step.getComparisonValue(), context);
                passes = conditionEvaluator.evaluate(
                        context.getTriggerPayload(), step.getFieldPath(), step.getOperator(), comparison);
            } catch (RuntimeException e) {
                fail(path, step, e, started);
                return false;
            }

            String branch = passes ? "then" : "else";
            ObjectNode detail = JsonNodeFactory.instance.objectNode();
            detail.put("passes", passes);
            detail.put("branch", branch);
            record(path, step, AttemptStatus.SUCCEEDED, null, started, detail);
            log.debug("Condition evaluated: run={}, step={}, field={}, operator={}, branch={}",
                    context.getRunId(), path, step.getFieldPath(), step.getOperator(), branch);

            return sequence(passes ? step.getThenSteps() : step.getElseSteps(), path + "." + branch);
        }

        private void fail(String path, Step step, RuntimeException e, long started) {
            failedPath = path;
            failure = failureMessage(path, step, e);
            record(path, step, AttemptStatus.FAILED, failure, started, null);
            log.warn("Step failed: run={}, attempt={}, {}",
                    context.getRunId(), context.getAttemptNumber(), failure);
        }

        private void record(String path, Step step, AttemptStatus status, String error,
                            long started, JsonNode detail) {
            trace.add(StepTrace.builder()
                    .stepPath(path)
                    .stepType(step.getType().value())
                    .status(status)
                    .errorMessage(error)
                    .durationMs((System.nanoTime() - started) / 1_000_000)
                    .detail(detail)
                    .build());
        }
    }
}
