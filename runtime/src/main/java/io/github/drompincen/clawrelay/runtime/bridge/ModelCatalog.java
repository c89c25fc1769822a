package io.github.drompincen.clawrelay.runtime.bridge;

import io.github.drompincen.clawrelay.protocol.api.ModelInfo;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.ModelListUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Lists models by running the runtime's CLI against the shared credential store. */
@Component
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private final RelayProperties properties;

    public ModelCatalog(RelayProperties properties) {
        this.properties = properties;
    }

    public List<ModelInfo> listModels() {
        RelayProperties.Runtime settings = properties.getRuntime();
        List<String> command = new ArrayList<>(settings.getCommand());
        command.addAll(List.of("models", settings.getModelsProvider(), "--refresh"));

        ProcessBuilder pb = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD);
        pb.environment().put("XDG_DATA_HOME", properties.getXdgDataHome().toString());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ModelListUnavailableException("Failed to run model listing: " + e.getMessage(), e);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(settings.getModelListTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ModelListUnavailableException("Model listing timed out after " + settings.getModelListTimeout());
            }
            int code = process.exitValue();
            if (code != 0) {
                throw new ModelListUnavailableException("Model listing failed with code " + code);
            }
            List<ModelInfo> models = parse(stdout.get(5, TimeUnit.SECONDS));
            log.info("Listed {} model(s)", models.size());
            return models;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ModelListUnavailableException("Interrupted while listing models", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ModelListUnavailableException("Could not read model listing output", e);
        }
    }

    /** Keeps lines that contain a {@code /}, read as {@code id - display name}. */
    static List<ModelInfo> parse(String output) {
        List<ModelInfo> models = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (!line.contains("/")) {
                continue;
            }
            int sep = line.indexOf(" - ");
            String id = (sep >= 0 ? line.substring(0, sep) : line).trim();
            String name = sep >= 0 ? line.substring(sep + 3).trim() : "";
            models.add(new ModelInfo(id, name.isEmpty() ? id : name));
        }
        return models;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
