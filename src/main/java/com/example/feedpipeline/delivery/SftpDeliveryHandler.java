package com.example.feedpipeline.delivery;

import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SFTP 投递。私钥优先于密码；配置 known_hosts 时启用严格主机校验。
 */
@Slf4j
@Component
public class SftpDeliveryHandler extends AbstractDeliveryHandler {

    private static final int DEFAULT_PORT = 22;

    private final Duration transferTimeout;

    public SftpDeliveryHandler(StorageSink storageSink,
            @Value("${app.feeds.delivery.transfer-timeout:60s}") Duration transferTimeout) {
        super(storageSink);
        this.transferTimeout = transferTimeout;
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.SFTP;
    }

    @Override
    protected void checkConfig(FeedDefinition feed, DeliveryConfig config) {
        config.require("host", "SFTP");
        config.require("username", "SFTP");
        config.getInt("port", DEFAULT_PORT);
        if (config.getString("private_key_path") == null && config.getString("password") == null) {
            throw new FeedConfigurationException("No SFTP authentication method provided");
        }
    }

    @Override
    protected DeliveryOutcome doDeliver(FeedDefinition feed, GenerationRecord generation, DeliveryConfig config)
            throws Exception {
        String host = config.require("host", "SFTP");
        int port = config.getInt("port", DEFAULT_PORT);
        String username = config.require("username", "SFTP");
        String password = config.getString("password");
        String privateKeyPath = config.getString("private_key_path");
        String passphrase = config.getString("private_key_passphrase");
        String knownHosts = config.getString("known_hosts");
        String remotePath = config.getString("remote_path", "/");

        checkConfig(feed, config);

        byte[] content = readArtifact(generation);
        String remoteFile = joinRemote(remotePath, fileName(generation));
        int timeoutMillis = (int) transferTimeout.toMillis();

        JSch jsch = new JSch();
        if (knownHosts != null) {
            jsch.setKnownHosts(knownHosts);
        }
        if (privateKeyPath != null) {
            jsch.addIdentity(privateKeyPath, passphrase);
        }

        Session session = null;
        ChannelSftp channel = null;
        try {
            session = jsch.getSession(username, host, port);
            if (privateKeyPath == null) {
                session.setPassword(password);
            }
            session.setConfig("StrictHostKeyChecking", knownHosts != null ? "yes" : "no");
            session.setTimeout(timeoutMillis);
            session.connect(timeoutMillis);

            channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(timeoutMillis);

            makeDirectories(channel, remotePath);
            try (InputStream in = new ByteArrayInputStream(content)) {
                channel.put(in, remoteFile);
            }
            log.info("Feed {} uploaded to sftp://{}:{}{}", feed.getSlug(), host, port, remoteFile);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
            if (session != null) {
                session.disconnect();
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("host", host);
        details.put("remote_path", remoteFile);
        details.put("size", content.length);
        return DeliveryOutcome.success(details);
    }

    private void makeDirectories(ChannelSftp channel, String remotePath) throws SftpException {
        if (remotePath == null || remotePath.isEmpty() || "/".equals(remotePath)) {
            return;
        }
        StringBuilder current = new StringBuilder(remotePath.startsWith("/") ? "/" : "");
        for (String segment : remotePath.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            current.append(segment);
            String path = current.toString();
            try {
                channel.stat(path);
            } catch (SftpException e) {
                if (e.id != ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    throw e;
                }
                channel.mkdir(path);
            }
            current.append('/');
        }
    }
}
