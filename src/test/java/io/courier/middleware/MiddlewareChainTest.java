package io.courier.middleware;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class MiddlewareChainTest {

    @Test
    void stepsRunInOrderAroundTerminal() throws Exception {
        List<String> trace = new ArrayList<>();
        TestContext context = new TestContext();
        ChainResult result = MiddlewareChain.run(List.<Middleware<TestContext>>of(
                (ctx, next) -> {
                    trace.add("a:before");
                    next.proceed();
                    trace.add("a:after");
                },
                (ctx, next) -> {
                    trace.add("b");
                    next.proceed();
                }
        ), context, ctx -> {
            trace.add("terminal");
            ctx.outcome = "done";
        });
        Assertions.assertEquals(ChainResult.COMPLETED, result);
        Assertions.assertEquals(List.of("a:before", "b", "terminal", "a:after"), trace);
    }

    @Test
    void stepSettingOutcomeShortCircuits() throws Exception {
        List<String> trace = new ArrayList<>();
        TestContext context = new TestContext();
        ChainResult result = MiddlewareChain.run(List.<Middleware<TestContext>>of(
                (ctx, next) -> {
                    ctx.outcome = "blocked";
                    next.proceed();
                },
                (ctx, next) -> trace.add("never")
        ), context, ctx -> trace.add("terminal"));
        Assertions.assertEquals(ChainResult.SHORT_CIRCUITED, result);
        Assertions.assertTrue(trace.isEmpty());
    }

    @Test
    void cancelledContextNeverReachesTerminal() throws Exception {
        List<String> trace = new ArrayList<>();
        TestContext context = new TestContext();
        ChainResult result = MiddlewareChain.run(List.<Middleware<TestContext>>of(
                (ctx, next) -> {
                    ctx.cancelled = true;
                    next.proceed();
                }
        ), context, ctx -> trace.add("terminal"));
        Assertions.assertEquals(ChainResult.FELL_THROUGH, result);
        Assertions.assertTrue(trace.isEmpty());
    }

    @Test
    void stepThatNeverProceedsFallsThrough() throws Exception {
        TestContext context = new TestContext();
        ChainResult result = MiddlewareChain.run(List.<Middleware<TestContext>>of((ctx, next) -> {
        }), context, ctx -> ctx.outcome = "x");
        Assertions.assertEquals(ChainResult.FELL_THROUGH, result);
        Assertions.assertNull(context.outcome);
    }

    @Test
    void emptyChainRunsTerminal() throws Exception {
        TestContext context = new TestContext();
        MiddlewareChain<TestContext> chain = new MiddlewareChain<>(List.of());
        Assertions.assertEquals(0, chain.size());
        Assertions.assertEquals(ChainResult.COMPLETED, chain.run(context, ctx -> ctx.outcome = "ok"));
        Assertions.assertEquals("ok", context.outcome);
    }

    @Test
    void exceptionsPropagateToCaller() {
        TestContext context = new TestContext();
        IllegalStateException thrown = Assertions.assertThrows(IllegalStateException.class, () ->
                MiddlewareChain.run(List.<Middleware<TestContext>>of((ctx, next) -> {
                    throw new IllegalStateException("boom");
                }), context, ctx -> ctx.outcome = "x"));
        Assertions.assertEquals("boom", thrown.getMessage());
    }

    private static final class TestContext implements PipelineContext {
        private boolean cancelled;
        private String outcome;

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean hasOutcome() {
            return outcome != null;
        }
    }
}
