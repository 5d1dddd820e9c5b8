package com.community.journal.achievement.rules;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.entity.BadgeType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * 打卡类：连续 7 天（streak_7）
 */
@Component
public class StreakWeekRule implements BadgeRule {

    @Override
    public BadgeType getBadgeType() {
        return BadgeType.STREAK_7;
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
