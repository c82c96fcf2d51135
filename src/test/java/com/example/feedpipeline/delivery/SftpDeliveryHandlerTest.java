package com.example.feedpipeline.delivery;

import com.example.feedpipeline.FeedFixtures;
import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.FileSystemStorageSink;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.KeyPair;
import org.apache.sshd.common.file.virtualfs.VirtualFileSystemFactory;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;
import org.apache.sshd.sftp.server.SftpSubsystemFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SftpDeliveryHandlerTest {

    @TempDir
    Path storageRoot;

    @TempDir
    Path serverRoot;

    @TempDir
    Path keyDir;

    private final AtomicInteger passwordAttempts = new AtomicInteger();
    private final AtomicInteger publicKeyChecks = new AtomicInteger();

    private SshServer sshServer;
    private FileSystemStorageSink storage;
    private SftpDeliveryHandler handler;

    @BeforeEach
    void setup() throws Exception {
        sshServer = SshServer.setUpDefaultServer();
        sshServer.setHost("127.0.0.1");
        sshServer.setPort(0);
        sshServer.setKeyPairProvider(new SimpleGeneratorHostKeyProvider(keyDir.resolve("hostkey.ser")));
        sshServer.setPasswordAuthenticator((username, password, session) -> {
            passwordAttempts.incrementAndGet();
            return "feeds".equals(username) && "secret".equals(password);
        });
        sshServer.setPublickeyAuthenticator((username, key, session) -> {
            boolean accepted = "feeds".equals(username);
            if (accepted) {
                publicKeyChecks.incrementAndGet();
            }
            return accepted;
        });
        sshServer.setKeyboardInteractiveAuthenticator(null);
        sshServer.setSubsystemFactories(Collections.singletonList(new SftpSubsystemFactory()));
        sshServer.setFileSystemFactory(new VirtualFileSystemFactory(serverRoot));
        sshServer.start();

        storage = new FileSystemStorageSink(storageRoot.toString());
        handler = new SftpDeliveryHandler(storage, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() throws Exception {
        sshServer.stop(true);
    }

    private Map<String, Object> serverConfig(String remotePath) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("host", "127.0.0.1");
        config.put("port", sshServer.getPort());
        config.put("username", "feeds");
        config.put("remote_path", remotePath);
        return config;
    }

    private String writeClientKey() throws Exception {
        KeyPair keyPair = KeyPair.genKeyPair(new JSch(), KeyPair.RSA, 2048);
        String path = keyDir.resolve("id_rsa").toString();
        keyPair.writePrivateKey(path);
        keyPair.dispose();
        return path;
    }

    private boolean sessionsClosed() throws InterruptedException {
        Instant deadline = Instant.now().plusSeconds(5);
        while (Instant.now().isBefore(deadline)) {
            if (sshServer.getActiveSessions().isEmpty()) {
                return true;
            }
            Thread.sleep(50);
        }
        return sshServer.getActiveSessions().isEmpty();
    }

    private static String fileName(GenerationRecord record) {
        return record.getFilePath().substring(record.getFilePath().lastIndexOf('/') + 1);
    }

    private FeedDefinition feed(Map<String, Object> config) {
        return FeedFixtures.catalogFeed(3L).deliveryMethod(DeliveryMethod.SFTP).deliveryConfig(config).build();
    }

    @Test
    void testRequiresAuthenticationMethod() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("host", "sftp.example.com");
        config.put("username", "feeds");
        FeedDefinition feed = feed(config);

        FeedConfigurationException e = assertThrows(FeedConfigurationException.class,
                () -> handler.validate(feed));
        assertEquals("No SFTP authentication method provided", e.getMessage());

        config.put("private_key_path", "/keys/id_rsa");
        assertDoesNotThrow(() -> handler.validate(feed));
    }

    @Test
    void testMissingHostFailsWithoutConnecting() throws Exception {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("username", "feeds");
        config.put("password", "secret");
        FeedDefinition feed = feed(config);
        GenerationRecord record = DeliveryTestSupport.generated(feed, storage, "sku\r\n");

        DeliveryOutcome outcome = handler.deliver(feed, record);

        assertFalse(outcome.isSuccess());
        assertEquals("Missing SFTP configuration: host", outcome.getError());
    }

    @Test
    void testUnreachableHostIsCapturedAsFailure() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("host", "127.0.0.1");
        config.put("port", closedPort);
        config.put("username", "feeds");
        config.put("password", "secret");
        config.put("remote_path", "/upload");
        FeedDefinition feed = feed(config);
        GenerationRecord record = DeliveryTestSupport.generated(feed, storage, "sku\r\n");

        DeliveryOutcome outcome = handler.deliver(feed, record);

        assertFalse(outcome.isSuccess());
        assertNotNull(outcome.getError());
    }

    @Test
    void testPasswordUploadCreatesNestedDirectories() throws Exception {
        Map<String, Object> config = serverConfig("/outbound/daily/acme");
        config.put("password", "secret");
        FeedDefinition feed = feed(config);
        GenerationRecord record = DeliveryTestSupport.generated(feed, storage, "sku,name\r\nA1,Bolt\r\n");

        DeliveryOutcome outcome = handler.deliver(feed, record);

        assertTrue(outcome.isSuccess(), outcome.getError());
        String remoteFile = "/outbound/daily/acme/" + fileName(record);
        assertEquals(remoteFile, outcome.getDetails().get("remote_path"));
        assertEquals(19, outcome.getDetails().get("size"));
        Path uploaded = serverRoot.resolve("outbound/daily/acme").resolve(fileName(record));
        assertEquals("sku,name\r\nA1,Bolt\r\n", Files.readString(uploaded, StandardCharsets.UTF_8));
        assertTrue(sessionsClosed());
    }

    @Test
    void testUploadIntoExistingDirectory() throws Exception {
        Files.createDirectories(serverRoot.resolve("incoming"));
        Map<String, Object> config = serverConfig("incoming");
        config.put("password", "secret");
        FeedDefinition feed = feed(config);
        GenerationRecord record = DeliveryTestSupport.generated(feed, storage, "sku\r\n");

        DeliveryOutcome outcome = handler.deliver(feed, record);

        assertTrue(outcome.isSuccess(), outcome.getError());
        assertTrue(Files.exists(serverRoot.resolve("incoming").resolve(fileName(record))));
    }

    @Test
    void testPrivateKeyWinsOverPassword() throws Exception {
        Map<String, Object> config = serverConfig("/keyed");
        config.put("private_key_path", writeClientKey());
        config.put("password", "not-the-password");
        FeedDefinition feed = feed(config);
        GenerationRecord record = DeliveryTestSupport.generated(feed, storage, "sku\r\n");

        DeliveryOutcome outcome = handler.deliver(feed, record);

        assertTrue(outcome.isSuccess(), outcome.getError());
        assertTrue(publicKeyChecks.get() >= 1);
        assertEquals(0, passwordAttempts.get());
        assertTrue(Files.exists(serverRoot.resolve("keyed").resolve(fileName(record))));
        assertTrue(sessionsClosed());
    }

    @Test
    void testRejectedLoginClosesSession() throws Exception {
        Map<String, Object> config = serverConfig("/outbound");
        config.put("password", "wrong");
        FeedDefinition feed = feed(config);
        GenerationRecord record = DeliveryTestSupport.generated(feed, storage, "sku\r\n");

        DeliveryOutcome outcome = handler.deliver(feed, record);

        assertFalse(outcome.isSuccess());
        assertNotNull(outcome.getError());
        assertTrue(passwordAttempts.get() >= 1);
        assertFalse(Files.exists(serverRoot.resolve("outbound")));
        assertTrue(sessionsClosed());
    }
}
