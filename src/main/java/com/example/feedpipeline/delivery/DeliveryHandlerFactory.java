package com.example.feedpipeline.delivery;

import com.example.feedpipeline.model.DeliveryMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 投递策略工厂。
 */
@Component
@RequiredArgsConstructor
public class DeliveryHandlerFactory {

    private final DownloadDeliveryHandler downloadDeliveryHandler;
    private final EmailDeliveryHandler emailDeliveryHandler;
    private final FtpDeliveryHandler ftpDeliveryHandler;
    private final SftpDeliveryHandler sftpDeliveryHandler;
    private final WebhookDeliveryHandler webhookDeliveryHandler;

    /**
     * 根据投递方式获取对应处理器。
     *
     * @param method 投递方式
     * @return 投递处理器
     */
    public DeliveryHandler getHandler(DeliveryMethod method) {
        if (method == null) {
            throw new IllegalArgumentException("Delivery method is required");
        }
        switch (method) {
            case DOWNLOAD:
                return downloadDeliveryHandler;
            case EMAIL:
                return emailDeliveryHandler;
            case FTP:
                return ftpDeliveryHandler;
            case SFTP:
                return sftpDeliveryHandler;
            case WEBHOOK:
                return webhookDeliveryHandler;
            default:
                throw new IllegalArgumentException("Unsupported delivery method: " + method);
        }
    }
}
