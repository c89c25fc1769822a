package io.github.drompincen.clawrelay.runtime.auth;

import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.RuntimeTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Automates the runtime CLI's interactive {@code auth login} against the shared credential store.
 * The terminal is driven by answering prompts and nudging with Enter until the CLI prints a
 * login URL; the operator completes the flow in a browser.
 */
@Service
public class InteractiveAuthService {

    private static final Logger log = LoggerFactory.getLogger(InteractiveAuthService.class);

    static final int OUTPUT_TAIL = 500;
    static final long EXIT_GRACE_SECONDS = 30;

    private final RelayProperties.Auth settings;
    private final String xdgDataHome;

    public InteractiveAuthService(RelayProperties properties) {
        this.settings = properties.getAuth();
        this.xdgDataHome = properties.getXdgDataHome().toString();
    }

    /** Starts a login on subscription. Cancelling the subscription kills the CLI. */
    public Flux<AuthEvent> performInteractiveAuth(String provider) {
        return Flux.create(sink -> new LoginAttempt(provider, sink).start());
    }

    private class LoginAttempt {

        private final String providerInput;
        private final FluxSink<AuthEvent> sink;
        private final StringBuilder output = new StringBuilder();
        private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auth-login-timer");
            t.setDaemon(true);
            return t;
        });

        private Process process;
        private OutputStream stdin;
        private boolean urlFound;
        private boolean selectionSent;
        private boolean finished;
        private int enterPulses;
        private ScheduledFuture<?> pulse;

        LoginAttempt(String provider, FluxSink<AuthEvent> sink) {
            this.providerInput = provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
            this.sink = sink;
        }

        void start() {
            List<String> command = new ArrayList<>(settings.getCommand());
            ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
            pb.environment().put("XDG_DATA_HOME", xdgDataHome);
            pb.environment().put("TERM", "xterm-256color");

            String label = settings.getProviderLabels().getOrDefault(providerInput, providerInput);
            log.info("Starting login for provider {} against {}", label, xdgDataHome);
            try {
                process = pb.start();
            } catch (IOException e) {
                log.error("Login process could not start", e);
                finish(AuthEvent.failed(e.getMessage()));
                return;
            }
            stdin = process.getOutputStream();
            sink.onDispose(this::dispose);

            Thread reader = new Thread(() -> read(process.getInputStream()), "auth-login-output");
            reader.setDaemon(true);
            reader.start();

            process.onExit().thenAccept(p -> onExit(p.exitValue()));
            timers.schedule(this::sendProviderSelection,
                    settings.getSelectionDelay().toMillis(), TimeUnit.MILLISECONDS);
            timers.schedule(this::onTimeout, settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        private void read(InputStream in) {
            char[] buffer = new char[4096];
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(buffer)) != -1) {
                    onOutput(AuthOutputScanner.stripAnsi(new String(buffer, 0, n)));
                }
            } catch (IOException e) {
                log.debug("Login output closed: {}", e.getMessage());
            }
        }

        private synchronized void onOutput(String text) {
            output.append(text);
            String snippet = text.replaceAll("\\s+", " ").trim();
            if (!snippet.isEmpty()) {
                log.debug("Login output: {}", snippet.length() > 200 ? snippet.substring(0, 200) : snippet);
            }
            if (!urlFound) {
                String url = AuthOutputScanner.extractUrl(text);
                if (url != null) {
                    urlFound = true;
                    log.info("Login URL detected");
                    if (!finished) {
                        sink.next(AuthEvent.urlDetected(url));
                    }
                }
            }
            if (AuthOutputScanner.containsAny(text, settings.getSuccessPhrases())) {
                log.info("Login completed successfully");
                finish(AuthEvent.succeeded());
                return;
            }
            if (!selectionSent && AuthOutputScanner.containsAnyIgnoreCase(text, settings.getPromptPhrases())) {
                sendProviderSelection();
            }
        }

        private synchronized void sendProviderSelection() {
            if (selectionSent || finished) {
                return;
            }
            selectionSent = true;
            log.info("Sending provider selection '{}'", providerInput);
            write(providerInput.isEmpty() ? "\n" : providerInput + "\n");
            long interval = settings.getEnterPulseInterval().toMillis();
            pulse = timers.scheduleAtFixedRate(this::enterPulse, interval, interval, TimeUnit.MILLISECONDS);
        }

        private synchronized void enterPulse() {
            if (finished || urlFound || enterPulses >= settings.getEnterPulseMax()) {
                if (pulse != null) {
                    pulse.cancel(false);
                }
                return;
            }
            enterPulses++;
            log.info("Sending Enter to advance login ({})", enterPulses);
            write("\n");
        }

        private synchronized void onExit(int exitCode) {
            log.info("Login process exited with code {}", exitCode);
            if (exitCode == 0) {
                finish(AuthEvent.succeeded());
            } else {
                finish(AuthEvent.failed("Login process exited with code " + exitCode + ". Output: "
                        + AuthOutputScanner.tail(output, OUTPUT_TAIL)));
            }
        }

        private synchronized void onTimeout() {
            if (finished) {
                return;
            }
            RuntimeTimeoutException timeout = new RuntimeTimeoutException(
                    "Login timeout (" + settings.getTimeout().toMinutes() + " minutes exceeded)");
            log.error("Login timed out, output: {}", AuthOutputScanner.tail(output, OUTPUT_TAIL));
            process.destroyForcibly();
            finish(AuthEvent.failed(timeout.getMessage()));
        }

        private void write(String value) {
            if (stdin == null) {
                return;
            }
            try {
                stdin.write(value.getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            } catch (IOException e) {
                log.debug("Login input rejected: {}", e.getMessage());
            }
        }

        private synchronized void finish(AuthEvent outcome) {
            if (finished) {
                return;
            }
            finished = true;
            if (outcome.type() == AuthEvent.Type.FAILED) {
                log.warn("Login failed: {}", outcome.reason());
            }
            sink.next(outcome);
            sink.complete();
            timers.shutdownNow();
        }

        private void dispose() {
            timers.shutdownNow();
            if (process == null || !process.isAlive()) {
                return;
            }
            boolean completed;
            synchronized (this) {
                completed = finished;
            }
            if (!completed) {
                process.destroyForcibly();
                return;
            }
            // a successful CLI may still be flushing credentials; give it a moment to exit
            process.onExit()
                    .completeOnTimeout(process, EXIT_GRACE_SECONDS, TimeUnit.SECONDS)
                    .thenAccept(p -> {
                        if (p.isAlive()) {
                            p.destroyForcibly();
                        }
                    });
        }
    }
}
