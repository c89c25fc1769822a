package io.github.drompincen.clawrelay.runtime.bridge;

import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.RuntimeStartFailedException;
import io.github.drompincen.clawrelay.runtime.workspace.SessionPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class ProcessRuntimeLauncher implements RuntimeLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessRuntimeLauncher.class);

    static final String LOG_FILE = "runtime.log";

    private final RelayProperties.Runtime settings;
    private final AgentRuntimeClient client;

    public ProcessRuntimeLauncher(RelayProperties properties, AgentRuntimeClient client) {
        this.settings = properties.getRuntime();
        this.client = client;
    }

    @Override
    public RuntimeHandle launch(SessionPaths paths, String policyJson) {
        int port = freePort();
        List<String> command = new ArrayList<>(settings.getCommand());
        command.addAll(List.of("serve",
                "--hostname", settings.getHostname(),
                "--port", Integer.toString(port),
                "--print-logs",
                "--log-level", settings.getLogLevel()));

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(paths.workspace().toFile())
                .redirectInput(ProcessBuilder.Redirect.PIPE);
        Map<String, String> env = pb.environment();
        env.put("XDG_DATA_HOME", paths.data().toString());
        env.put("HOME", paths.workspace().toString());
        env.put("OPENCODE_PERMISSION", policyJson);

        log.info("Starting runtime on port {} in {}", port, paths.workspace());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new RuntimeStartFailedException("Failed to start runtime: " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close runtime stdin: {}", e.getMessage());
        }

        URI baseUri = URI.create("http://" + settings.getHostname() + ":" + port);
        RuntimeProcess runtime = new RuntimeProcess(process, port, baseUri, paths.logs().resolve(LOG_FILE));
        awaitHealthy(runtime);
        log.info("Runtime ready on port {}", port);
        return runtime;
    }

    private void awaitHealthy(RuntimeProcess runtime) {
        long deadline = System.nanoTime() + settings.getStartupTimeout().toNanos();
        long pollMillis = Math.max(1, settings.getHealthPollInterval().toMillis());
        while (System.nanoTime() < deadline) {
            if (!runtime.isAlive()) {
                int code = runtime.process().exitValue();
                throw new RuntimeStartFailedException("Runtime exited during startup with code " + code);
            }
            if (client.health(runtime.baseUri())) {
                return;
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                runtime.stop();
                Thread.currentThread().interrupt();
                throw new RuntimeStartFailedException("Interrupted while waiting for runtime", e);
            }
        }
        runtime.stop();
        throw new RuntimeStartFailedException("Runtime not healthy after " + settings.getStartupTimeout());
    }

    static int freePort() {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("No free local port", e);
        }
    }
}
