package com.community.journal.service;

import com.community.journal.dto.BadgeDTO;
import com.community.journal.dto.BadgeProgressDTO;

import java.util.List;
import java.util.Map;

public interface BadgeService {

    /**
     * 根据用户当前的已持久化数据评估全部规则，发放新达到的徽章。
     *
     * @return 本次新获得的徽章 id（已拥有的不会重复返回）
     */
    List<String> evaluateBadges(Long userId);

    List<BadgeDTO> getUserBadges(Long userId);

    Map<String, BadgeProgressDTO> getBadgeProgress(Long userId, int currentStreak);

    List<BadgeDTO> getBadgeDefinitions();

    /**
     * 月度冠军徽章，由外部（月度定时任务）显式发放。
     *
     * @return true 表示本次新发放
     */
    boolean awardMonthlyTop(Long userId, String month);
}
