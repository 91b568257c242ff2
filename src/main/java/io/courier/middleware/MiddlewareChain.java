package io.courier.middleware;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, short-circuiting chain of {@link Middleware} steps around a {@link Terminal}.
 *
 * <p>Exceptions thrown by a step or by the terminal propagate to the caller of {@link #run}.
 */
public final class MiddlewareChain<C extends PipelineContext> {
    private final List<Middleware<C>> steps;

    public MiddlewareChain(List<Middleware<C>> steps) {
        this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    }

    public static <C extends PipelineContext> ChainResult run(
            List<Middleware<C>> steps,
            C context,
            Terminal<C> terminal
    ) throws Exception {
        return new MiddlewareChain<>(steps).run(context, terminal);
    }

    public ChainResult run(C context, Terminal<C> terminal) throws Exception {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(terminal, "terminal");
        Run run = new Run(context, terminal);
        run.proceedFrom(0);
        if (run.terminalCalls > 0) {
            return ChainResult.COMPLETED;
        }
        return context.hasOutcome() ? ChainResult.SHORT_CIRCUITED : ChainResult.FELL_THROUGH;
    }

    public int size() {
        return steps.size();
    }

    private final class Run {
        private final C context;
        private final Terminal<C> terminal;
        private int terminalCalls;

        private Run(C context, Terminal<C> terminal) {
            this.context = context;
            this.terminal = terminal;
        }

        private void proceedFrom(int index) throws Exception {
            if (context.isHalted()) {
                return;
            }
            if (index >= steps.size()) {
                terminalCalls++;
                terminal.complete(context);
                return;
            }
            Middleware<C> step = steps.get(index);
            step.handle(context, () -> proceedFrom(index + 1));
        }
    }
}
