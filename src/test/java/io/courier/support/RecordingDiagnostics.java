package io.courier.support;

import io.courier.observability.DiagnosticEvent;
import io.courier.observability.DiagnosticsSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public final class RecordingDiagnostics implements DiagnosticsSink {
    private final List<DiagnosticEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(DiagnosticEvent event) {
        events.add(event);
    }

    public List<DiagnosticEvent> events() {
        return List.copyOf(events);
    }

    public List<DiagnosticEvent> byCategory(String category) {
        return events.stream().filter(e -> e.category().equals(category)).collect(Collectors.toList());
    }

    public List<String> categories() {
        return events.stream().map(DiagnosticEvent::category).collect(Collectors.toList());
    }
}
