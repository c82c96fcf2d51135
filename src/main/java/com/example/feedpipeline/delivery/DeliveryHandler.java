package com.example.feedpipeline.delivery;

import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;

/**
 * 投递策略接口。
 * 实现类不抛异常，所有失败都折叠为 {@link DeliveryOutcome#failure(String)}。
 */
public interface DeliveryHandler {

    DeliveryMethod method();

    /**
     * 在任何 I/O 之前校验投递配置。
     *
     * @param feed Feed 配置
     * @throws com.example.feedpipeline.exception.FeedConfigurationException 配置缺失或非法
     */
    void validate(FeedDefinition feed);

    /**
     * 投递已生成的文件。
     *
     * @param feed       Feed 配置
     * @param generation 已处于 GENERATED 或 DELIVERING 的生成记录
     * @return 投递结果
     */
    DeliveryOutcome deliver(FeedDefinition feed, GenerationRecord generation);
}
