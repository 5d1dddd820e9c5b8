package com.community.journal.stats;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreakResult {
    private int currentStreak;      // 当前连续天数
    private int longestStreak;      // 历史最长连续天数
    private LocalDate lastEntryDate; // 最后一条记录日期，无记录为 null

    public static StreakResult empty() {
        return new StreakResult(0, 0, null);
    }
}
