package com.community.journal.achievement.rules;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.entity.BadgeType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * 猜测类：连续 5 天猜中作者（detective_streak_5）
 */
@Component
public class DetectiveStreakRule implements BadgeRule {

    @Override
    public BadgeType getBadgeType() {
        return BadgeType.DETECTIVE_STREAK_5;
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.getDetectiveStreak() >= getBadgeType().getRequirement();
    }

    @Override
    public Map<String, Object> metadata(BadgeContext context) {
        return Collections.singletonMap("streak", context.getDetectiveStreak());
    }
}
