package com.example.feedpipeline.model;

/**
 * 投递方式。DOWNLOAD 不做传输，仅标记文件可下载。
 */
public enum DeliveryMethod {
    DOWNLOAD,
    EMAIL,
    FTP,
    SFTP,
    WEBHOOK
}
