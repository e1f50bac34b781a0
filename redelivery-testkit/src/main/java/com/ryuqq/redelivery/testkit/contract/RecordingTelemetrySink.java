package com.ryuqq.redelivery.testkit.contract;

import com.ryuqq.redelivery.core.spi.TelemetrySink;
import com.ryuqq.redelivery.core.telemetry.RedeliveryEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * {@link TelemetrySink} that keeps every reported event in memory.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public class RecordingTelemetrySink implements TelemetrySink {

    private final List<RedeliveryEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void report(RedeliveryEvent event) {
        events.add(event);
    }

    /**
     * Returns a snapshot of all events in report order.
     *
     * @return recorded events
     */
    public List<RedeliveryEvent> events() {
        return new ArrayList<>(events);
    }

    /**
     * Returns recorded events with the given name.
     *
     * @param eventName event name, e.g. {@code "OnRedeliver"}
     * @return matching events in report order
     */
    public List<RedeliveryEvent> eventsNamed(String eventName) {
        return events.stream()
                .filter(event -> event.eventName().equals(eventName))
                .collect(Collectors.toList());
    }

    /**
     * Removes all recorded events.
     */
    public void clear() {
        events.clear();
    }
}
