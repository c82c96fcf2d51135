package com.example.feedpipeline.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * 基于本地（或挂载的共享）文件系统的存储实现。
 */
@Component
@Slf4j
public class FileSystemStorageSink implements StorageSink {

    private final Path root;

    public FileSystemStorageSink(@Value("${app.feeds.storage.root:./data/feed-files}") String root) {
        this.root = Paths.get(root).toAbsolutePath().normalize();
    }

    @Override
    public StoredFile save(String path, byte[] content) throws IOException {
        Path target = resolve(path);
        Files.createDirectories(target.getParent());

        // 先写临时文件再原子替换，避免读到半截文件
        Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        long size = Files.size(target);
        log.debug("Stored {} ({} bytes)", path, size);
        return new StoredFile(path, size);
    }

    @Override
    public byte[] open(String path) throws IOException {
        return Files.readAllBytes(resolve(path));
    }

    @Override
    public boolean exists(String path) {
        try {
            return Files.isRegularFile(resolve(path));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be empty");
        }
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Storage path escapes root: " + path);
        }
        return resolved;
    }
}
