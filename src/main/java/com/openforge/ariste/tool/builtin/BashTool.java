package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command through {@code sh -c} in its own process.
 *
 * stdout is returned on exit code 0; otherwise stderr (or the exit code when
 * stderr is empty) becomes the error. Output streams are drained concurrently
 * on the tool's own pool so a chatty command cannot fill a pipe and stall, even
 * while other work saturates the shared fork-join pool.
 */
@Slf4j
public class BashTool implements AgentTool {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "bash",
            "Execute bash commands in the shell",
            """
            {
              "type": "object",
              "properties": {
                "command": {
                  "type": "string",
                  "description": "The bash command to execute (e.g., 'ls -la', 'pwd', 'echo hello')"
                }
              },
              "required": ["command"]
            }
            """);

    private final Path            workingDirectory;
    private final Duration        timeout;
    private final ExecutorService drainers = Executors.newCachedThreadPool();

    public BashTool(Path workingDirectory) {
        this(workingDirectory, DEFAULT_TIMEOUT);
    }

    public BashTool(Path workingDirectory, Duration timeout) {
        this.workingDirectory = workingDirectory;
        this.timeout          = timeout;
    }

    @PreDestroy
    public void shutdown() {
        drainers.shutdownNow();
        try {
            if (!drainers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[BashTool] Output drainers did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String command = ToolArguments.requireString(arguments, "command");

        Process process;
        try {
            process = new ProcessBuilder("sh", "-c", command)
                    .directory(workingDirectory.toFile())
                    .start();
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to execute command: " + e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("[BashTool] Could not close stdin: {}", e.getMessage());
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolExecutionException(
                        "Command timed out after %d seconds".formatted(timeout.toSeconds()));
            }
            int exit = process.exitValue();
            String out = stdout.get();
            String err = stderr.get();
            if (exit == 0) {
                return out;
            }
            throw new ToolExecutionException(
                    err.isEmpty() ? "Command failed with exit code: " + exit : err);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Command interrupted", e);
        } catch (ExecutionException e) {
            throw new ToolExecutionException("Failed to read command output: " + e.getCause().getMessage(), e);
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, drainers);
    }
}
