package com.example.feedpipeline.service;

import com.example.feedpipeline.delivery.DeliveryHandlerFactory;
import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.generator.FieldResolver;
import com.example.feedpipeline.model.FeedDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 生成前的配置校验。失败抛出 {@link FeedConfigurationException}，此时尚未产生任何 I/O。
 */
@Component
@RequiredArgsConstructor
public class FeedDefinitionValidator {

    private final FieldResolver fieldResolver;
    private final DeliveryHandlerFactory deliveryHandlerFactory;

    public void validate(FeedDefinition feed) {
        if (feed.getFeedType() == null) {
            throw new FeedConfigurationException("Feed type is required");
        }
        if (feed.getFormat() == null) {
            throw new FeedConfigurationException("Feed format is required");
        }
        if (feed.getOwner() == null || feed.getOwner().getId() == null) {
            throw new FeedConfigurationException("Feed owner is required");
        }
        if (feed.getDeliveryMethod() == null) {
            throw new FeedConfigurationException("Delivery method is required");
        }

        validateSchedule(feed);
        fieldResolver.validateMapping(feed.getCustomFieldMapping());
        deliveryHandlerFactory.getHandler(feed.getDeliveryMethod()).validate(feed);
    }

    private void validateSchedule(FeedDefinition feed) {
        if (feed.getFrequency() == null) {
            throw new FeedConfigurationException("Frequency is required");
        }
        Integer day = feed.getScheduleDay();
        switch (feed.getFrequency()) {
            case DAILY:
                if (feed.getScheduleTime() == null) {
                    throw new FeedConfigurationException("Schedule time is required for daily feeds");
                }
                break;
            case WEEKLY:
                if (day == null || day < 0 || day > 6) {
                    throw new FeedConfigurationException("Weekly feeds need a schedule day between 0 (Monday) and 6");
                }
                break;
            case MONTHLY:
                if (day == null || day < 1 || day > 31) {
                    throw new FeedConfigurationException("Monthly feeds need a schedule day between 1 and 31");
                }
                break;
            default:
                break;
        }
    }
}
