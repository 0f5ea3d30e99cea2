package com.volsignal.engine.service;

import com.volsignal.engine.dto.DecisionReport;
import com.volsignal.engine.dto.DecisionRequest;
import com.volsignal.engine.exception.InvalidDecisionRequestException;
import com.volsignal.engine.logger.DecisionFlowLogger;
import com.volsignal.engine.pipeline.DecisionPipelineEngine;
import com.volsignal.engine.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive entry point for one evaluation. Validates the request, then runs the
 * synchronous pipeline on {@code boundedElastic} with the trace id in context.
 */
@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private final DecisionPipelineEngine pipelineEngine;
    private final DecisionFlowLogger flowLogger;

    public DecisionService(DecisionPipelineEngine pipelineEngine, DecisionFlowLogger flowLogger) {
        this.pipelineEngine = pipelineEngine;
        this.flowLogger     = flowLogger;
    }

    public Mono<DecisionReport> evaluate(DecisionRequest request, String traceId) {
        String rejection = validate(request);
        if (rejection != null) {
            flowLogger.logRejected(rejection, traceId);
            return Mono.error(new InvalidDecisionRequestException(rejection));
        }

        flowLogger.logStage(DecisionFlowLogger.REQUEST_RECEIVED, request.symbol(), traceId);

        Mono<DecisionReport> evaluation = Mono.fromCallable(() -> pipelineEngine.evaluate(request, traceId))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(DecisionFlowLogger.EVALUATION_COMPLETE))
            .doOnError(e -> TraceContextUtil.withMdc(traceId, request.symbol(), () ->
                log.error("Evaluation failed for symbol={} traceId={}", request.symbol(), traceId, e)));

        return TraceContextUtil.withTraceId(evaluation, traceId);
    }

    static String validate(DecisionRequest request) {
        if (request == null) return "request body is required";
        if (request.symbol() == null || request.symbol().isBlank()) return "symbol is required";
        if (request.snapshot() == null) return "snapshot is required";
        return null;
    }
}
