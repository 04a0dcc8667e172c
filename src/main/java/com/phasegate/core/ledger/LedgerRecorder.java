package com.phasegate.core.ledger;

import com.phasegate.core.events.PhaseEvent;
import com.phasegate.core.events.PhaseEventBus;
import com.phasegate.core.events.PhaseEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.function.Consumer;

/**
 * Writes every committed transition published on the {@link PhaseEventBus} to the {@link PhaseLedger}.
 * Rejections are not recorded.
 */
public class LedgerRecorder implements Consumer<PhaseEvent> {

    private static final Logger log = LoggerFactory.getLogger(LedgerRecorder.class);

    private final PhaseLedger ledger;
    private PhaseEventBus.Subscription subscription;

    public LedgerRecorder(PhaseLedger ledger) {
        this.ledger = ledger;
    }

    public synchronized LedgerRecorder attach(PhaseEventBus bus) {
        if (subscription == null) {
            subscription = bus.on(EnumSet.of(PhaseEventType.CYCLE_STARTED, PhaseEventType.PHASE_COMMITTED,
                    PhaseEventType.CYCLE_CLOSED), this);
            log.info("Recording committed transitions to {}", ledger.path());
        }
        return this;
    }

    public synchronized void detach() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    @Override
    public void accept(PhaseEvent event) {
        if (!event.type().committed()) {
            return;
        }
        ledger.append(event.taskId(), event.fromPhase(), event.toPhase(), event.kind(),
                event.evidenceArtifacts(), event.evidenceValidated());
    }
}
