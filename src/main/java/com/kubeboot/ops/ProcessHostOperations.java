package com.kubeboot.ops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link HostOperations} backed by real operating system processes.
 * Privileged commands are run through {@code nsenter} targeting PID 1.
 */
public class ProcessHostOperations implements HostOperations {
    private static final Logger log = LoggerFactory.getLogger(ProcessHostOperations.class);
    private static final String NSENTER = "nsenter";
    private static final List<String> NSENTER_ARGS = List.of("-t", "1", "-m", "-i", "--");

    @Override
    public String execPrivilegeCommand(Writer liveLogger, String command, String... args) throws CommandExecutionException {
        List<String> full = new ArrayList<>(NSENTER_ARGS);
        full.add(command);
        full.addAll(Arrays.asList(args));
        return execCommand(liveLogger, NSENTER, full.toArray(new String[0]));
    }

    @Override
    public String execCommand(Writer liveLogger, String command, String... args) throws CommandExecutionException {
        List<String> argList = Arrays.asList(args);
        List<String> cmdLine = new ArrayList<>();
        cmdLine.add(command);
        cmdLine.addAll(argList);
        log.debug("Executing {} {}", command, argList);

        Process process;
        try {
            process = new ProcessBuilder(cmdLine).start();
        } catch (IOException e) {
            throw new CommandExecutionException(command, argList, e);
        }
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            String stdout = copyOutput(process.getInputStream(), liveLogger);
            int exit = process.waitFor();
            String err = stderr.get();
            if (exit != 0) {
                throw new CommandExecutionException(command, argList, exit, err.trim(), lastLine(stdout));
            }
            return stdout;
        } catch (IOException | ExecutionException e) {
            process.destroyForcibly();
            throw new CommandExecutionException(command, argList, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CommandExecutionException(command, argList, e);
        }
    }

    private static String copyOutput(InputStream in, Writer liveLogger) throws IOException {
        StringBuilder out = new StringBuilder();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            char[] chunk = new char[4096];
            int n;
            while ((n = reader.read(chunk)) != -1) {
                out.append(chunk, 0, n);
                if (liveLogger != null) {
                    liveLogger.write(chunk, 0, n);
                }
            }
        }
        if (liveLogger != null) {
            liveLogger.flush();
        }
        return out.toString();
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String lastLine(String output) {
        String trimmed = output.trim();
        int idx = trimmed.lastIndexOf('\n');
        return idx < 0 ? trimmed : trimmed.substring(idx + 1);
    }
}
