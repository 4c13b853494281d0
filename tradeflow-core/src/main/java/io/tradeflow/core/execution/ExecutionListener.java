package io.tradeflow.core.execution;

/// Receives {@link TraceEvent}s as a program runs.
///
/// Called synchronously on the executing thread, in event order. A listener
/// that throws aborts the run.
///
/// ### Usage
/// {@snippet :
/// ExecutionListener printer = event -> System.out.println(event.describe());
/// environment.newExecutor(printer).execute(program);
/// }
///
/// @see TraceEvent for event types
/// @see ProgramExecutor for event emission
@FunctionalInterface
public interface ExecutionListener {

    /// Called for every event.
    ///
    /// @param event the event, never null
    void onEvent(TraceEvent event);

    /// Listener that ignores all events.
    ExecutionListener NOOP = event -> {};
}
