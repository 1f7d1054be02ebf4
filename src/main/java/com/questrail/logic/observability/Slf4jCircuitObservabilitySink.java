package com.questrail.logic.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CircuitObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCircuitObservabilitySink implements CircuitObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCircuitObservabilitySink.class);

    @Override
    public void onStateTransition(CircuitStateTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("Circuit state: {} -> {} (terminated)", event.oldState(), event.newState());
        } else {
            log.info("Circuit state: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onBlockTask(BlockTaskEvent event) {
        switch (event.outcome()) {
            case COMPLETED -> log.debug("Block '{}' {} task completed in {} ms",
                event.blockName(), event.phase(), event.elapsed().toMillis());
            case TIMED_OUT -> log.warn("Block '{}' {} task timed out after {} ms",
                event.blockName(), event.phase(), event.elapsed().toMillis());
            case FAILED -> log.warn("Block '{}' {} task failed after {} ms",
                event.blockName(), event.phase(), event.elapsed().toMillis());
            case CANCELLED -> log.info("Block '{}' {} task cancelled after {} ms",
                event.blockName(), event.phase(), event.elapsed().toMillis());
        }
    }

    @Override
    public void onError(CircuitErrorEvent event) {
        if (event.blockName() != null) {
            log.error("Circuit error in block '{}': {}", event.blockName(), event.message(), event.cause());
        } else {
            log.error("Circuit error: {}", event.message(), event.cause());
        }
    }
}
