package io.courier.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.courier.client.ClientMiddlewares;
import io.courier.client.ClientRequestEngine;
import io.courier.client.Completion;
import io.courier.client.RequestFailedException;
import io.courier.client.RetryPolicy;
import io.courier.config.CourierSettings;
import io.courier.observability.DiagnosticsSink;
import io.courier.observability.JsonLinesDiagnostics;
import io.courier.protocol.Response;
import io.courier.scheduling.ExecutorTaskScheduler;
import io.courier.server.HandlerOutcome;
import io.courier.server.ServerMiddlewares;
import io.courier.server.ServerRouter;
import io.courier.transport.LoopbackTransport;
import io.courier.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "courier",
        mixinStandardHelpOptions = true,
        description = "Courier request/response messaging CLI",
        subcommands = {
                CourierCommand.SettingsCommand.class,
                CourierCommand.LoopbackCommand.class
        }
)
public final class CourierCommand implements Runnable {
    static final String ANNOUNCEMENT_EVENT = "announcement";

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        out().println("Use subcommands: settings | loopback");
        out().flush();
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    @Command(name = "settings", description = "Print effective settings as JSON")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Option(names = {"--settings"}, description = "Settings JSON file (defaults apply when absent)")
        Path settingsFile;

        @Override
        public Integer call() {
            PrintWriter out = parent.out();
            out.println(Jsons.toPrettyJson(CourierSettings.load(settingsFile).toFileView()));
            out.flush();
            return 0;
        }
    }

    @Command(name = "loopback", description = "Run a server and clients on the in-process transport and issue one request per client")
    static final class LoopbackCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Option(names = {"--settings"}, description = "Settings JSON file (defaults apply when absent)")
        Path settingsFile;

        @Option(names = {"--clients"}, defaultValue = "1", description = "Number of client sessions")
        int clients;

        @Option(names = {"--action"}, defaultValue = "ping", description = "Action to request: ping|echo|announce|<other>")
        String action;

        @Option(names = {"--payload"}, description = "Request payload as JSON")
        String payload;

        @Option(names = {"--admin"}, split = ",", defaultValue = "client-1",
                description = "Session ids allowed to call admin actions")
        List<String> admins;

        @Option(names = {"--diagnostics"}, description = "Optional JSON-lines diagnostics file")
        Path diagnosticsFile;

        @Override
        public Integer call() throws Exception {
            if (clients < 1) {
                throw new IllegalArgumentException("--clients must be >= 1");
            }
            CourierSettings settings = CourierSettings.load(settingsFile);
            JsonNode requestPayload = payload == null ? null : Jsons.parse(payload);
            DiagnosticsSink diagnostics = diagnosticsFile == null
                    ? DiagnosticsSink.noop()
                    : new JsonLinesDiagnostics(diagnosticsFile, "loopback");
            PrintWriter out = parent.out();
            LoopbackTransport transport = new LoopbackTransport();
            Set<String> adminIds = new LinkedHashSet<>(admins);

            try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("courier-cli-timers");
                 ServerRouter router = ServerRouter.builder(transport)
                         .settings(settings)
                         .diagnostics(diagnostics)
                         .dispatchExecutor(Runnable::run)
                         .build()) {
                router.init();
                router.use(ServerMiddlewares.validation());
                router.use(ServerMiddlewares.security(settings, Clock.systemUTC()));
                router.useForAction("announce", ServerMiddlewares.admin(adminIds::contains));
                router.handle("ping", (senderId, body) -> HandlerOutcome.ok(Map.of("pong", true, "sender", senderId)));
                router.handle("echo", (senderId, body) -> HandlerOutcome.ok(body));
                router.handle("announce", (senderId, body) -> {
                    router.broadcast(ANNOUNCEMENT_EVENT, body);
                    return HandlerOutcome.ok(Map.of("delivered", transport.sessionIds().size()));
                });

                List<ClientRequestEngine> engines = new ArrayList<>();
                for (int i = 1; i <= clients; i++) {
                    String sessionId = "client-" + i;
                    ClientRequestEngine engine = ClientRequestEngine.builder(transport.connect(sessionId))
                            .settings(settings)
                            .diagnostics(diagnostics)
                            .scheduler(scheduler)
                            .build();
                    engine.init();
                    engine.use(ClientMiddlewares.throttle(settings, Clock.systemUTC(), scheduler));
                    engine.use(ClientMiddlewares.retry(RetryPolicy.fromSettings(settings), scheduler,
                            error -> !(error instanceof RequestFailedException)));
                    engine.onServerMessage(ANNOUNCEMENT_EVENT, event -> printLine(out, eventRow(sessionId, event)));
                    engines.add(engine);
                }

                int failures = 0;
                for (ClientRequestEngine engine : engines) {
                    Completion<Response> completion = engine.request(action, requestPayload);
                    Map<String, Object> row = await(engine.sessionId(), completion, settings);
                    if (!Boolean.TRUE.equals(row.get("success"))) {
                        failures++;
                    }
                    printLine(out, row);
                }
                for (ClientRequestEngine engine : engines) {
                    transport.disconnect(engine.sessionId());
                }
                return failures == 0 ? 0 : 1;
            }
        }

        private Map<String, Object> await(String sessionId, Completion<Response> completion, CourierSettings settings)
                throws InterruptedException {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("session", sessionId);
            row.put("action", action);
            try {
                Response response = completion.toCompletableFuture()
                        .get(awaitBudgetMs(settings), TimeUnit.MILLISECONDS);
                row.put("success", true);
                row.put("data", response.data());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                row.put("success", false);
                row.put("error", cause instanceof RequestFailedException failed ? failed.error() : String.valueOf(cause.getMessage()));
                row.put("errorType", cause.getClass().getSimpleName());
            } catch (TimeoutException e) {
                completion.cancel();
                row.put("success", false);
                row.put("error", "no response");
                row.put("errorType", e.getClass().getSimpleName());
            }
            return row;
        }

        private static long awaitBudgetMs(CourierSettings settings) {
            RetryPolicy policy = RetryPolicy.fromSettings(settings);
            long budget = 1_000L;
            for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
                budget += settings.requestTimeoutMs() + policy.backoffMs(attempt) + policy.maxJitterMs();
            }
            return budget;
        }

        private static ObjectNode eventRow(String sessionId, JsonNode event) {
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.put("session", sessionId);
            row.put("event", ANNOUNCEMENT_EVENT);
            row.set("payload", event);
            return row;
        }

        private static void printLine(PrintWriter out, Object row) {
            out.println(Jsons.toJson(row));
            out.flush();
        }
    }
}
