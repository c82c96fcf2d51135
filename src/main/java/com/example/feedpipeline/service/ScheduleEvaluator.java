package com.example.feedpipeline.service;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.Frequency;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Optional;

/**
 * 调度规则：判断 feed 当前是否到期，以及计算下一次运行时间（仅用于展示）。
 * 周几使用 0 = 周一 ... 6 = 周日。
 */
@Component
public class ScheduleEvaluator {

    /**
     * 判断 feed 在 now 时刻是否应自动生成。
     *
     * @param feed feed 配置
     * @param now  当前时间
     * @return true 表示到期
     */
    public boolean isDue(FeedDefinition feed, LocalDateTime now) {
        if (!feed.isActive() || feed.getFrequency() == null || feed.getFrequency() == Frequency.MANUAL) {
            return false;
        }
        LocalDateTime last = feed.getLastGenerated();

        switch (feed.getFrequency()) {
            case HOURLY:
                return last == null || !Duration.between(last, now).minusHours(1).isNegative();

            case DAILY:
                if (feed.getScheduleTime() == null) {
                    return false;
                }
                boolean ranToday = last != null && !last.toLocalDate().isBefore(now.toLocalDate());
                return !ranToday && !now.toLocalTime().isBefore(feed.getScheduleTime());

            case WEEKLY:
                if (feed.getScheduleDay() == null) {
                    return false;
                }
                if (weekdayIndex(now) != feed.getScheduleDay()) {
                    return false;
                }
                return last == null || Duration.between(last, now).toDays() >= 7;

            case MONTHLY:
                // 本月不存在的日期（如 2 月 31 日）不触发
                if (feed.getScheduleDay() == null || now.getDayOfMonth() != feed.getScheduleDay()) {
                    return false;
                }
                return last == null || !YearMonth.from(last).equals(YearMonth.from(now));

            default:
                return false;
        }
    }

    /**
     * 下一次运行时间。MANUAL 或停用的 feed 返回空。
     */
    public Optional<LocalDateTime> nextRunTime(FeedDefinition feed, LocalDateTime now) {
        if (!feed.isActive() || feed.getFrequency() == null || feed.getFrequency() == Frequency.MANUAL) {
            return Optional.empty();
        }
        switch (feed.getFrequency()) {
            case HOURLY:
                return Optional.of(now.plusHours(1));

            case DAILY: {
                if (feed.getScheduleTime() == null) {
                    return Optional.empty();
                }
                LocalDateTime next = now.toLocalDate().atTime(feed.getScheduleTime());
                return Optional.of(next.isAfter(now) ? next : next.plusDays(1));
            }

            case WEEKLY: {
                if (feed.getScheduleDay() == null) {
                    return Optional.empty();
                }
                int daysAhead = feed.getScheduleDay() - weekdayIndex(now);
                if (daysAhead <= 0) {
                    daysAhead += 7;
                }
                return Optional.of(now.plusDays(daysAhead));
            }

            case MONTHLY: {
                Integer day = feed.getScheduleDay();
                if (day == null) {
                    return Optional.empty();
                }
                YearMonth month = YearMonth.from(now);
                if (month.isValidDay(day)) {
                    return Optional.of(now.withDayOfMonth(day));
                }
                return Optional.of(month.plusMonths(1).atDay(1).atTime(now.toLocalTime()));
            }

            default:
                return Optional.empty();
        }
    }

    static int weekdayIndex(LocalDateTime dateTime) {
        return dateTime.getDayOfWeek().getValue() - 1;
    }
}
