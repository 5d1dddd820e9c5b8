package com.community.journal.dto;

import com.community.journal.stats.MonthRange;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 个人统计面板（/stats/me 与 /stats/users/{id} 共用）
 */
@Data
public class UserStatsDTO {
    private Long userId;
    private String username;
    private LocalDate today;
    private MonthRange month;

    private DailyEntryDTO lastEntry;
    private LocalDate lastEntryDate;
    private TodayEntryDTO todayEntry;

    private long participationCount;   // 累计记录天数
    private Double monthAverage;       // 当月均分，无记录为 null
    private List<DailyEntryDTO> monthEntries;

    private int currentStreak;
    private int longestStreak;

    private List<BadgeDTO> badges;
    private Map<String, BadgeProgressDTO> badgeProgress;
}
