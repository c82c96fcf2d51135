package com.example.feedpipeline.storage;

import java.io.IOException;

/**
 * 生成文件的存储端口（对象存储或文件系统），需支持同进程内写后读。
 */
public interface StorageSink {

    /**
     * 保存文件内容。
     *
     * @param path    相对路径
     * @param content 文件内容
     * @return 实际保存路径与大小
     */
    StoredFile save(String path, byte[] content) throws IOException;

    byte[] open(String path) throws IOException;

    boolean exists(String path);
}
