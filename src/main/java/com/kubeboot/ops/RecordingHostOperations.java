package com.kubeboot.ops;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link HostOperations} that records every invocation and answers
 * with scripted output. Nothing is executed.
 */
public class RecordingHostOperations implements HostOperations {

    /** A single recorded call. */
    public static final class Invocation {
        private final boolean privileged;
        private final String command;
        private final List<String> args;
        private final Writer liveLogger;

        Invocation(boolean privileged, String command, List<String> args, Writer liveLogger) {
            this.privileged = privileged;
            this.command = command;
            this.args = List.copyOf(args);
            this.liveLogger = liveLogger;
        }

        public boolean isPrivileged() {
            return privileged;
        }

        public String getCommand() {
            return command;
        }

        public List<String> getArgs() {
            return args;
        }

        public Writer getLiveLogger() {
            return liveLogger;
        }
    }

    private final List<Invocation> invocations = new ArrayList<>();
    private final Map<String, String> outputs = new HashMap<>();
    private final Map<String, CommandExecutionException> failures = new HashMap<>();

    /** Reply with the given output whenever {@code command} is run. */
    public synchronized RecordingHostOperations respond(String command, String output) {
        outputs.put(command, output);
        failures.remove(command);
        return this;
    }

    /** Fail with the given exception whenever {@code command} is run. */
    public synchronized RecordingHostOperations fail(String command, CommandExecutionException error) {
        failures.put(command, error);
        outputs.remove(command);
        return this;
    }

    public synchronized List<Invocation> getInvocations() {
        return new ArrayList<>(invocations);
    }

    @Override
    public String execPrivilegeCommand(Writer liveLogger, String command, String... args) throws CommandExecutionException {
        return record(true, liveLogger, command, args);
    }

    @Override
    public String execCommand(Writer liveLogger, String command, String... args) throws CommandExecutionException {
        return record(false, liveLogger, command, args);
    }

    private synchronized String record(boolean privileged, Writer liveLogger, String command, String... args)
            throws CommandExecutionException {
        invocations.add(new Invocation(privileged, command, Arrays.asList(args), liveLogger));
        CommandExecutionException failure = failures.get(command);
        if (failure != null) {
            throw failure;
        }
        String output = outputs.getOrDefault(command, "");
        if (liveLogger != null && !output.isEmpty()) {
            try {
                liveLogger.write(output);
                liveLogger.flush();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return output;
    }
}
