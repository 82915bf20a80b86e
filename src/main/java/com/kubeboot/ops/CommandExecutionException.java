package com.kubeboot.ops;

import java.util.List;

/**
 * Thrown when a host command cannot be started or exits with a non-zero status.
 */
public class CommandExecutionException extends Exception {
    private final String command;
    private final List<String> args;
    private final int exitCode;
    private final String stderr;
    private final String lastOutput;

    public CommandExecutionException(String command, List<String> args, int exitCode, String stderr, String lastOutput) {
        super(String.format("failed executing %s %s, exit code %d, stderr \"%s\", last output \"%s\"",
                command, args, exitCode, stderr, lastOutput));
        this.command = command;
        this.args = List.copyOf(args);
        this.exitCode = exitCode;
        this.stderr = stderr;
        this.lastOutput = lastOutput;
    }

    public CommandExecutionException(String command, List<String> args, Throwable cause) {
        super(String.format("failed executing %s %s: %s", command, args, cause.getMessage()), cause);
        this.command = command;
        this.args = List.copyOf(args);
        this.exitCode = -1;
        this.stderr = "";
        this.lastOutput = "";
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    /** Process exit code, or -1 when the process could not be run at all. */
    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }

    public String getLastOutput() {
        return lastOutput;
    }
}
