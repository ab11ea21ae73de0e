package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.model.compilation.CompilationPhase;
import com.pulsar.blueprint_compiler.model.compilation.CompilationProgressEvent;
import com.pulsar.blueprint_compiler.model.compilation.CompilationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Reports compilation progress as Spring application events; editors listen for
 * {@link CompilationProgressEvent} to show what the compiler is doing.
 */
@Slf4j
@Component
public class CompilationEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public CompilationEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public CompilationProgressEvent phaseStarted(String compilationId, CompilationPhase phase) {
        return publish(compilationId, phase, CompilationStatus.STARTED, null);
    }

    public CompilationProgressEvent phaseCompleted(String compilationId, CompilationPhase phase, String detail) {
        return publish(compilationId, phase, CompilationStatus.COMPLETED, detail);
    }

    public CompilationProgressEvent phaseFailed(String compilationId, CompilationPhase phase, String error) {
        return publish(compilationId, phase, CompilationStatus.FAILED, error);
    }

    private CompilationProgressEvent publish(String compilationId, CompilationPhase phase,
                                             CompilationStatus status, String detail) {
        CompilationProgressEvent event = new CompilationProgressEvent(compilationId, phase, status, detail);
        log.debug("[COMPILER] publish: compilationId={}, phase={}, status={}, detail={}", compilationId, phase, status, detail);
        applicationEventPublisher.publishEvent(event);
        return event;
    }
}
