package io.tradeflow.core.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Listener that keeps every event of a run in order.
///
/// @implNote **Not thread-safe**. One trace per run.
public final class ExecutionTrace implements ExecutionListener {

    private final List<TraceEvent> events = new ArrayList<>();

    @Override
    public void onEvent(TraceEvent event) {
        events.add(event);
    }

    /// Returns the recorded events, unmodifiable view.
    public List<TraceEvent> events() {
        return Collections.unmodifiableList(events);
    }

    /// Returns one rendered line per event, in order.
    public List<String> lines() {
        List<String> lines = new ArrayList<>(events.size());
        for (TraceEvent event : events) {
            lines.add(event.describe());
        }
        return List.copyOf(lines);
    }

    public int size() {
        return events.size();
    }
}
