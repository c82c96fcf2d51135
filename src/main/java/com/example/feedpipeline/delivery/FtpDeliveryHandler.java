package com.example.feedpipeline.delivery;

import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * FTP 投递：被动模式 + 二进制传输，远程目录不存在时逐级创建。
 */
@Slf4j
@Component
public class FtpDeliveryHandler extends AbstractDeliveryHandler {

    private static final int DEFAULT_PORT = 21;

    private final Duration transferTimeout;

    public FtpDeliveryHandler(StorageSink storageSink,
            @Value("${app.feeds.delivery.transfer-timeout:60s}") Duration transferTimeout) {
        super(storageSink);
        this.transferTimeout = transferTimeout;
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.FTP;
    }

    @Override
    protected void checkConfig(FeedDefinition feed, DeliveryConfig config) {
        config.require("host", "FTP");
        config.require("username", "FTP");
        config.require("password", "FTP");
        config.getInt("port", DEFAULT_PORT);
    }

    @Override
    protected DeliveryOutcome doDeliver(FeedDefinition feed, GenerationRecord generation, DeliveryConfig config)
            throws Exception {
        String host = config.require("host", "FTP");
        int port = config.getInt("port", DEFAULT_PORT);
        String username = config.require("username", "FTP");
        String password = config.require("password", "FTP");
        String remotePath = config.getString("remote_path", "/");

        byte[] content = readArtifact(generation);
        String fileName = fileName(generation);

        FTPClient ftp = new FTPClient();
        ftp.setConnectTimeout((int) transferTimeout.toMillis());
        ftp.setDefaultTimeout((int) transferTimeout.toMillis());
        ftp.setDataTimeout(transferTimeout);
        try {
            ftp.connect(host, port);
            if (!FTPReply.isPositiveCompletion(ftp.getReplyCode())) {
                throw new IOException("FTP server refused connection: " + ftp.getReplyString());
            }
            if (!ftp.login(username, password)) {
                throw new IOException("FTP login failed for " + username + "@" + host);
            }
            ftp.enterLocalPassiveMode();
            ftp.setFileType(FTP.BINARY_FILE_TYPE);

            changeToDirectory(ftp, remotePath);

            try (InputStream in = new ByteArrayInputStream(content)) {
                if (!ftp.storeFile(fileName, in)) {
                    throw new IOException("FTP upload failed: " + ftp.getReplyString());
                }
            }
            log.info("Feed {} uploaded to ftp://{}:{}{}", feed.getSlug(), host, port, joinRemote(remotePath, fileName));
        } finally {
            close(ftp);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("host", host);
        details.put("remote_path", joinRemote(remotePath, fileName));
        details.put("size", content.length);
        return DeliveryOutcome.success(details);
    }

    /**
     * 逐级进入目录，不存在则创建。
     */
    private void changeToDirectory(FTPClient ftp, String remotePath) throws IOException {
        if (remotePath == null || remotePath.isEmpty() || "/".equals(remotePath)) {
            return;
        }
        if (remotePath.startsWith("/") && !ftp.changeWorkingDirectory("/")) {
            throw new IOException("Cannot change to FTP root directory");
        }
        for (String segment : remotePath.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (ftp.changeWorkingDirectory(segment)) {
                continue;
            }
            if (!ftp.makeDirectory(segment) || !ftp.changeWorkingDirectory(segment)) {
                throw new IOException("Cannot create FTP directory '" + segment + "': " + ftp.getReplyString());
            }
        }
    }

    private void close(FTPClient ftp) {
        if (!ftp.isConnected()) {
            return;
        }
        try {
            ftp.logout();
        } catch (IOException e) {
            log.debug("FTP logout failed: {}", e.getMessage());
        }
        try {
            ftp.disconnect();
        } catch (IOException e) {
            log.warn("FTP disconnect failed: {}", e.getMessage());
        }
    }
}
