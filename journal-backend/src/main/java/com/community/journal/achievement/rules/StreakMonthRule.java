package com.community.journal.achievement.rules;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.entity.BadgeType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * 打卡类：连续 30 天（streak_30）
 */
@Component
public class StreakMonthRule implements BadgeRule {

    @Override
    public BadgeType getBadgeType() {
        return BadgeType.STREAK_30;
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.getCurrentStreak() >= getBadgeType().getRequirement();
    }

    @Override
    public Map<String, Object> metadata(BadgeContext context) {
        return Collections.singletonMap("streak", context.getCurrentStreak());
    }
}
