package com.community.journal.achievement;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * 徽章评估所需的已持久化信号快照，由 BadgeService 一次性装配。
 */
@Data
@Builder
public class BadgeContext {
    private Long userId;
    private LocalDate today;

    // 打卡
    private int currentStreak;
    private Integer lastEntryRating;
    private LocalDate lastEntryDate;

    // 互评 / 猜测
    private long ratingsGiven;
    private long correctGuesses;
    private int detectiveStreak;
}
