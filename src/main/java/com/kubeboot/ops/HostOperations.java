package com.kubeboot.ops;

import java.io.Writer;

/**
 * Host level operations needed by the bootstrap client. Implementations may
 * spawn real processes or just record what they were asked to do.
 */
public interface HostOperations {
    /**
     * Run a command inside the host's mount and IPC namespaces.
     *
     * @param liveLogger receives the command's standard output as it is produced
     * @param command executable name
     * @param args command arguments
     * @return captured standard output
     */
    String execPrivilegeCommand(Writer liveLogger, String command, String... args) throws CommandExecutionException;

    /** Run a command directly in the current namespaces. */
    String execCommand(Writer liveLogger, String command, String... args) throws CommandExecutionException;
}
