package com.community.journal.stats;

import com.community.journal.dto.DailyEntryDTO;
import com.community.journal.dto.RecapDTO;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 汇总统计：平均分、前 N 名、每日回顾。
 */
@Component
public class StatsCalculator {

    public static final int DEFAULT_TOP = 3;

    /**
     * 平均分，保留一位小数；空列表返回 0
     */
    public double average(List<Integer> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return 0.0;
        }
        double avg = ratings.stream()
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);
        return round1(avg);
    }

    /**
     * 数据库 AVG 结果归一为一位小数，null 保持 null
     */
    public Double normalizeAverage(Double value) {
        return value == null ? null : round1(value);
    }

    /**
     * @param sortedByRatingDesc 已按分数降序的记录
     */
    public List<DailyEntryDTO> topN(List<DailyEntryDTO> sortedByRatingDesc, int n) {
        if (sortedByRatingDesc == null || n <= 0) {
            return new ArrayList<>();
        }
        return new ArrayList<>(sortedByRatingDesc.subList(0, Math.min(n, sortedByRatingDesc.size())));
    }

    public RecapDTO recap(LocalDate date, List<DailyEntryDTO> sortedByRatingDesc, long ratingsGiven) {
        List<DailyEntryDTO> entries = sortedByRatingDesc == null ? new ArrayList<>() : sortedByRatingDesc;
        List<Integer> ratings = new ArrayList<>();
        for (DailyEntryDTO entry : entries) {
            ratings.add(entry.getRating());
        }

        RecapDTO recap = new RecapDTO();
        recap.setDate(date);
        recap.setParticipantCount(entries.size());
        recap.setAvgRating(average(ratings));
        recap.setTop3(topN(entries, DEFAULT_TOP));
        recap.setRatingsGiven(ratingsGiven);
        return recap;
    }

    /**
     * 百分比（四舍五入），total 为 0 时返回 0
     */
    public int percent(long part, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(part * 100.0 / total);
    }

    private static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
