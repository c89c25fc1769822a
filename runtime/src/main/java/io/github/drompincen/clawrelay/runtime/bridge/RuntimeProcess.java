package io.github.drompincen.clawrelay.runtime.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;

/**
 * {@link RuntimeHandle} backed by an OS process. Both output streams are pumped line by line into
 * this class's logger and the session's {@code runtime.log}.
 */
class RuntimeProcess implements RuntimeHandle {

    private static final Logger log = LoggerFactory.getLogger(RuntimeProcess.class);

    private final Process process;
    private final int port;
    private final URI baseUri;
    private final BufferedWriter logWriter;

    RuntimeProcess(Process process, int port, URI baseUri, Path logFile) {
        this.process = process;
        this.port = port;
        this.baseUri = baseUri;
        this.logWriter = openLog(logFile);
        pump(process.getInputStream(), "stdout");
        pump(process.getErrorStream(), "stderr");
        process.onExit().thenAccept(p -> {
            log.info("Runtime on port {} exited with code {}", port, p.exitValue());
            closeLog();
        });
    }

    @Override public int port() { return port; }
    @Override public URI baseUri() { return baseUri; }
    @Override public boolean isAlive() { return process.isAlive(); }

    Process process() { return process; }

    @Override
    public void stop() {
        if (!process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped runtime on port {}", port);
    }

    private void pump(InputStream stream, String label) {
        Thread pump = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String trimmed = line.trim();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    log.info("[{}] {}: {}", port, label, trimmed);
                    appendLog(label + ": " + trimmed);
                }
            } catch (IOException e) {
                log.debug("Runtime {} pump on port {} closed: {}", label, port, e.getMessage());
            }
        }, "runtime-" + port + "-" + label);
        pump.setDaemon(true);
        pump.start();
    }

    private static BufferedWriter openLog(Path logFile) {
        if (logFile == null) {
            return null;
        }
        try {
            Files.createDirectories(logFile.getParent());
            return Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Cannot write runtime log {}: {}", logFile, e.getMessage());
            return null;
        }
    }

    private synchronized void appendLog(String line) {
        if (logWriter == null) {
            return;
        }
        try {
            logWriter.write(line);
            logWriter.newLine();
            logWriter.flush();
        } catch (IOException e) {
            log.debug("Runtime log write failed: {}", e.getMessage());
        }
    }

    private synchronized void closeLog() {
        if (logWriter == null) {
            return;
        }
        try {
            logWriter.close();
        } catch (IOException e) {
            log.debug("Runtime log close failed: {}", e.getMessage());
        }
    }
}
