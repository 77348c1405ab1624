package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.graph.EventCycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects handlers that trigger each other forever.
 * Each distinct simple cycle of the event graph is one error.
 */
@Slf4j
@Component
@Order(50)
public class CircularEventChainCheck implements ProgramCheck {

    @Override
    public List<Diagnostic> check(CheckContext context) {
        List<EventCycle> cycles = context.eventGraph().cycles();
        log.debug("Found {} event cycles", cycles.size());

        List<Diagnostic> findings = new ArrayList<>();
        for (EventCycle cycle : cycles) {
            String handlers = String.join(", ", cycle.featureSets());
            findings.add(Diagnostic.builder(DiagnosticKind.CIRCULAR_EVENT_CHAIN)
                    .message("Circular event chain detected: %s", cycle.describe())
                    .location(cycle.location())
                    .hints("Handlers on this chain emit each other's events, causing an infinite loop at runtime",
                            cycle.isSelfLoop()
                                    ? "Stop the handler from emitting the event it handles"
                                    : "Break the cycle by removing one of the Emit statements or emitting a different event",
                            "Feature sets involved: " + handlers)
                    .build());
        }
        return findings;
    }
}
