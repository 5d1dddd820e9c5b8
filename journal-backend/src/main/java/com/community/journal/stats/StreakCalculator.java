package com.community.journal.stats;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 连续天数计算（纯函数，无状态）。
 *
 * 【打卡连续】
 * - 最长连续：对升序日期扫描一次，后一天恰好比前一天晚一个自然日则累加。
 * - 当前连续：从今天往回数；今天没有记录则从昨天开始数（今天还没写不算断），
 *   昨天也没有则为 0。
 *
 * 【侦探连胜】
 * 连续自然日里每天都猜中作者的天数，从最近一次猜测往回数。
 */
@Component
public class StreakCalculator {

    /**
     * @param ascendingDates 用户全部记录日期（升序，可为 null）
     * @param today 参照"今天"
     */
    public StreakResult calculate(List<LocalDate> ascendingDates, LocalDate today) {
        if (ascendingDates == null || ascendingDates.isEmpty()) {
            return StreakResult.empty();
        }

        Set<LocalDate> dates = new HashSet<>(ascendingDates);
        LocalDate lastEntryDate = ascendingDates.get(ascendingDates.size() - 1);

        // 1. 最长连续
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate date : ascendingDates) {
            if (previous != null && date.equals(previous)) {
                continue; // 同一天重复出现不计
            }
            run = (previous != null && previous.plusDays(1).equals(date)) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = date;
        }

        // 2. 当前连续
        LocalDate cursor = dates.contains(today) ? today : today.minusDays(1);
        int current = 0;
        while (dates.contains(cursor)) {
            current++;
            cursor = cursor.minusDays(1);
        }

        return new StreakResult(current, longest, lastEntryDate);
    }

    /**
     * 当前侦探连胜。
     *
     * @param outcomes 日期 -> 是否猜中作者（只包含猜了作者的日期）
     */
    public int detectiveStreak(Map<LocalDate, Boolean> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return 0;
        }
        List<LocalDate> newestFirst = new ArrayList<>(outcomes.keySet());
        newestFirst.sort(Collections.reverseOrder());

        int streak = 0;
        LocalDate expected = newestFirst.get(0);
        for (LocalDate date : newestFirst) {
            if (!date.equals(expected) || !Boolean.TRUE.equals(outcomes.get(date))) {
                break;
            }
            streak++;
            expected = date.minusDays(1);
        }
        return streak;
    }

    /**
     * 历史最长侦探连胜。
     */
    public int longestDetectiveStreak(Map<LocalDate, Boolean> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return 0;
        }
        List<LocalDate> oldestFirst = new ArrayList<>(outcomes.keySet());
        Collections.sort(oldestFirst);

        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate date : oldestFirst) {
            if (!Boolean.TRUE.equals(outcomes.get(date))) {
                run = 0;
            } else if (run > 0 && previous.plusDays(1).equals(date)) {
                run++;
            } else {
                run = 1;
            }
            longest = Math.max(longest, run);
            previous = date;
        }
        return longest;
    }
}
