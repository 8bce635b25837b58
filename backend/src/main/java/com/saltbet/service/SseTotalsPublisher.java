package com.saltbet.service;

import com.saltbet.model.SideTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes side totals to connected server-sent-event subscribers.
 */
@Service
public class SseTotalsPublisher implements TotalsListener {

    private static final Logger log = LoggerFactory.getLogger(SseTotalsPublisher.class);
    static final String EVENT_NAME = "totals";
    private static final long EMITTER_TIMEOUT_MS = 30 * 60 * 1000L;

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe(SideTotals initialTotals) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));
        emitters.add(emitter);

        if (initialTotals != null && !send(emitter, initialTotals)) {
            emitters.remove(emitter);
        }
        return emitter;
    }

    @Override
    public void onTotals(SideTotals totals) {
        for (SseEmitter emitter : emitters) {
            if (!send(emitter, totals)) {
                emitters.remove(emitter);
            }
        }
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private boolean send(SseEmitter emitter, SideTotals totals) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(totals));
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("Dropping totals subscriber: {}", ex.getMessage());
            emitter.completeWithError(ex);
            return false;
        }
    }
}
