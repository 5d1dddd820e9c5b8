package com.community.journal.service;

import com.community.journal.dto.DailyEntryDTO;
import com.community.journal.dto.DetectiveRankDTO;
import com.community.journal.dto.GuessStatsDTO;
import com.community.journal.dto.MonthlyLeaderboardItemDTO;
import com.community.journal.dto.RecapDTO;
import com.community.journal.dto.UserStatsDTO;

import java.util.List;
import java.util.Optional;

public interface StatsService {

    UserStatsDTO getMyStats(Long userId, String month);

    /**
     * 其他用户的统计面板，用户不存在抛 NotFoundException
     */
    UserStatsDTO getUserStats(Long userId, String month);

    /**
     * @param date YYYY-MM-DD，为空则取今天
     */
    RecapDTO getDailyRecap(String date);

    GuessStatsDTO getGuessStats(Long userId);

    List<DetectiveRankDTO> getDetectiveLeaderboard(Integer limit);

    /**
     * @param date YYYY-MM-DD，为空则取今天
     */
    List<DailyEntryDTO> getDailyLeaderboard(String date);

    List<MonthlyLeaderboardItemDTO> getMonthlyLeaderboard(String month);

    /**
     * 向指定月份排行第一的用户发放 top_1_monthly。
     *
     * @return 冠军用户 id；该月无记录时为空
     */
    Optional<Long> awardMonthlyChampion(String month);
}
