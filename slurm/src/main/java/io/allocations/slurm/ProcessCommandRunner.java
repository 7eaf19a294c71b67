package io.allocations.slurm;

import io.allocations.source.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands as child processes. Output goes through temporary files so a chatty command cannot block on a
 * full pipe. Any failure to get a clean exit within the timeout is reported as the source being unavailable.
 */
public class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Duration timeout;

    public ProcessCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public String run(List<String> command) throws SourceUnavailableException {
        String commandLine = String.join(" ", command);
        log.debug("Running {}", commandLine);
        Path out = null;
        Path err = null;
        Process process = null;
        try {
            out = Files.createTempFile("slurm-", ".out");
            err = Files.createTempFile("slurm-", ".err");
            process = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            process.getOutputStream().close();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SourceUnavailableException("Command did not finish within " + timeout.toSeconds() + " s: " + commandLine);
            }
            String stderr = Files.readString(err, StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                throw new SourceUnavailableException("Command exited with " + process.exitValue() + ": " + commandLine
                        + (stderr.isEmpty() ? "" : " (" + stderr + ")"));
            }
            if (!stderr.isEmpty()) log.warn("Standard error output for running {}: {}", commandLine, stderr);
            return Files.readString(out, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to run " + commandLine, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while running " + commandLine, e);
        } finally {
            if (process != null && process.isAlive()) process.destroyForcibly();
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}", file, e);
        }
    }
}
