package com.kubeboot.core;

import com.kubeboot.ops.CommandExecutionException;
import com.kubeboot.ops.RecordingHostOperations;
import com.kubeboot.ops.Slf4jLogWriter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AdminCommandBridgeTest {

    @Test
    public void testKubeconfigIsPrepended() throws Exception {
        RecordingHostOperations ops = new RecordingHostOperations().respond("oc", "NAME       STATUS\nmaster-0   Ready\n");
        AdminCommandBridge bridge = new AdminCommandBridge(ClientSettings.DEFAULT_ADMIN_COMMAND);

        String out = bridge.run(List.of("get", "nodes"), "/tmp/kubeconfig", ops);

        assertEquals("NAME       STATUS\nmaster-0   Ready\n", out);
        List<RecordingHostOperations.Invocation> calls = ops.getInvocations();
        assertEquals(1, calls.size());
        RecordingHostOperations.Invocation call = calls.get(0);
        assertTrue(call.isPrivileged());
        assertEquals("oc", call.getCommand());
        assertEquals(List.of("--kubeconfig=/tmp/kubeconfig", "get", "nodes"), call.getArgs());
        assertInstanceOf(Slf4jLogWriter.class, call.getLiveLogger());
    }

    @Test
    public void testExecutionErrorPassesThroughUnchanged() {
        CommandExecutionException failure = new CommandExecutionException("oc", List.of("--kubeconfig=/k", "adm"), 1,
                "error: unknown command", "");
        RecordingHostOperations ops = new RecordingHostOperations().fail("oc", failure);
        AdminCommandBridge bridge = new AdminCommandBridge("oc");

        CommandExecutionException thrown = assertThrows(CommandExecutionException.class,
                () -> bridge.run(List.of("adm"), "/k", ops));
        assertSame(failure, thrown);
    }

    @Test
    public void testConfiguredCommandIsUsedByClient() throws Exception {
        RecordingHostOperations ops = new RecordingHostOperations();
        ClientSettings settings = new ClientSettings(null, "kubectl", RetryPolicy.none(), 0);
        try (FakeApiServer api = new FakeApiServer();
             ClusterClient client = DefaultClusterClient.connect(api.writeKubeconfig().toString(), settings)) {
            client.runAdminCommand(List.of("get", "csr"), "/etc/kubernetes/kubeconfig", ops);
        }
        RecordingHostOperations.Invocation call = ops.getInvocations().get(0);
        assertEquals("kubectl", call.getCommand());
        assertEquals(List.of("--kubeconfig=/etc/kubernetes/kubeconfig", "get", "csr"), call.getArgs());
    }
}
