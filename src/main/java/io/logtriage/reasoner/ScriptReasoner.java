package io.logtriage.reasoner;

import io.logtriage.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command per request: the request envelope goes to stdin as JSON, the
 * command's stdout is parsed as the JSON answer.
 */
public final class ScriptReasoner implements Reasoner {
    private final List<String> command;
    private final long timeoutMs;

    public ScriptReasoner(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script reasoner command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public ReasonerResult reason(ReasonerRequest request) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ReasonerResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            byte[] input = Jsons.toCompactJson(request.toEnvelope()).getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return ReasonerResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            String output = stdout.get(1, TimeUnit.SECONDS);
            if (process.exitValue() != 0) {
                return ReasonerResult.fail("script exit=" + process.exitValue() + " output="
                        + ReasonerResponses.truncate(output));
            }
            return ReasonerResponses.parse(output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ReasonerResult.fail("script interrupted");
        } catch (ExecutionException | TimeoutException | IOException e) {
            process.destroyForcibly();
            return ReasonerResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
