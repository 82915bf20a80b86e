package com.kubeboot.core;

import com.kubeboot.ops.CommandExecutionException;
import com.kubeboot.ops.HostOperations;
import com.kubeboot.ops.Slf4jLogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the cluster administration tool on the host with the bootstrap
 * kubeconfig injected.
 */
public class AdminCommandBridge {
    private static final Logger log = LoggerFactory.getLogger(AdminCommandBridge.class);

    private final String command;

    public AdminCommandBridge(String command) {
        this.command = command;
    }

    public String getCommand() {
        return command;
    }

    public String run(List<String> args, String kubeconfigPath, HostOperations ops) throws CommandExecutionException {
        log.info("Running {} command with args {}", command, args);
        List<String> full = new ArrayList<>(args.size() + 1);
        full.add("--kubeconfig=" + kubeconfigPath);
        full.addAll(args);
        return ops.execPrivilegeCommand(new Slf4jLogWriter(log), command, full.toArray(new String[0]));
    }
}
