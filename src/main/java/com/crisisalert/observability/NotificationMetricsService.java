package com.crisisalert.observability;

import com.crisisalert.event.AlertStatusChangedEvent;
import com.crisisalert.event.ChannelDeliveryFailedEvent;
import com.crisisalert.event.EscalationCompletedEvent;
import com.crisisalert.notification.AlertLifecycleTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the delivery engine:
 * <ul>
 *   <li><b>alerts.status.transitions</b> (counter, tag status): every lifecycle transition</li>
 *   <li><b>alerts.channel.failures</b> (counter, tags channel and outcome): failed channel calls</li>
 *   <li><b>alerts.escalations</b> (counter): completed emergency-contact cascades</li>
 *   <li><b>alerts.escalation.contact.failures</b> (counter): failed contact attempts</li>
 *   <li><b>alerts.tracked</b> (gauge): alerts currently held by the tracker</li>
 * </ul>
 */
@Service
public class NotificationMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter escalationCounter;
    private final Counter escalationContactFailureCounter;

    public NotificationMetricsService(MeterRegistry meterRegistry, AlertLifecycleTracker alertLifecycleTracker) {
        this.meterRegistry = meterRegistry;

        this.escalationCounter = Counter.builder("alerts.escalations")
                .description("Emergency-contact cascades completed")
                .register(meterRegistry);

        this.escalationContactFailureCounter = Counter.builder("alerts.escalation.contact.failures")
                .description("Emergency-contact messages that could not be sent")
                .register(meterRegistry);

        meterRegistry.gauge("alerts.tracked", alertLifecycleTracker, AlertLifecycleTracker::getTrackedCount);
    }

    @EventListener
    public void onStatusChanged(AlertStatusChangedEvent event) {
        meterRegistry
                .counter("alerts.status.transitions", "status", event.getNewStatus().name())
                .increment();
    }

    @EventListener
    public void onChannelFailure(ChannelDeliveryFailedEvent event) {
        meterRegistry
                .counter(
                        "alerts.channel.failures",
                        "channel",
                        event.getChannel().name(),
                        "outcome",
                        event.getOutcomeType().name())
                .increment();
    }

    @EventListener
    public void onEscalationCompleted(EscalationCompletedEvent event) {
        escalationCounter.increment();
        escalationContactFailureCounter.increment(event.getFailedAttempts());
    }
}
