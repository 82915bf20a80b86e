package com.kubeboot.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class ClusterClientFactoryTest {

    private static Path writeProps(Properties p) throws Exception {
        Path file = Files.createTempFile("kubeboot", ".properties");
        try (var out = Files.newOutputStream(file)) {
            p.store(out, "");
        }
        file.toFile().deleteOnExit();
        return file;
    }

    @Test
    public void testLoadsPropertiesFile() throws Exception {
        assumeTrue(System.getenv("RETRY_MAX_ATTEMPTS") == null && System.getenv("ADMIN_COMMAND") == null);
        Properties p = new Properties();
        p.setProperty("ADMIN_COMMAND", "kubectl");
        p.setProperty("RETRY_MAX_ATTEMPTS", "4");
        p.setProperty("RETRY_BACKOFF_MILLIS", "250");
        p.setProperty("REQUEST_TIMEOUT_MILLIS", "15000");
        ClientSettings settings = new ClusterClientFactory(writeProps(p)).getSettings();

        assertEquals("kubectl", settings.getAdminCommand());
        assertEquals(4, settings.getRetryPolicy().getMaxAttempts());
        assertEquals(Duration.ofMillis(250), settings.getRetryPolicy().getBackoff());
        assertEquals(15000, settings.getRequestTimeoutMillis());
    }

    @Test
    public void testSystemPropertyWinsOverFile() throws Exception {
        Properties p = new Properties();
        p.setProperty("ADMIN_COMMAND", "kubectl");
        System.setProperty("ADMIN_COMMAND", "oc-4.14");
        try {
            assertEquals("oc-4.14", new ClusterClientFactory(writeProps(p)).getSettings().getAdminCommand());
        } finally {
            System.clearProperty("ADMIN_COMMAND");
        }
    }

    @Test
    public void testDefaultsAndBadNumbers() throws Exception {
        assumeTrue(System.getenv("RETRY_MAX_ATTEMPTS") == null && System.getenv("ADMIN_COMMAND") == null);
        Properties p = new Properties();
        p.setProperty("RETRY_MAX_ATTEMPTS", "many");
        ClientSettings settings = new ClusterClientFactory(writeProps(p)).getSettings();
        assertEquals("oc", settings.getAdminCommand());
        assertSame(RetryPolicy.none(), settings.getRetryPolicy());

        ClientSettings missingFile = new ClusterClientFactory(Path.of("does-not-exist.properties")).getSettings();
        assertEquals(0, missingFile.getRequestTimeoutMillis());
    }

    @Test
    public void testClientFromConfiguredKubeconfig() throws Exception {
        try (FakeApiServer api = new FakeApiServer()) {
            api.onJson("GET", "/api/v1/nodes", 200, "{\"apiVersion\":\"v1\",\"kind\":\"NodeList\",\"metadata\":{},\"items\":[]}");
            Properties p = new Properties();
            System.setProperty("KUBECONFIG", api.writeKubeconfig().toString());
            try (ClusterClient client = new ClusterClientFactory(writeProps(p)).getClient()) {
                assertTrue(client.listNodes().getItems().isEmpty());
            } finally {
                System.clearProperty("KUBECONFIG");
            }
        }
    }

    @Test
    public void testMissingKubeconfigSetting() throws Exception {
        assumeTrue(System.getenv("KUBECONFIG") == null);
        ClusterClientFactory factory = new ClusterClientFactory(writeProps(new Properties()));
        ClusterConfigException e = assertThrows(ClusterConfigException.class, factory::getClient);
        assertEquals(ClusterConfigException.Stage.LOAD_KUBECONFIG, e.getStage());
    }
}
