package com.community.journal.achievement.rules;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.entity.BadgeType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * 互评类：累计打分 100 次（reviewer_100）
 */
@Component
public class ReviewerRule implements BadgeRule {

    @Override
    public BadgeType getBadgeType() {
        return BadgeType.REVIEWER_100;
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.getRatingsGiven() >= getBadgeType().getRequirement();
    }

    @Override
    public Map<String, Object> metadata(BadgeContext context) {
        return Collections.singletonMap("totalRatings", context.getRatingsGiven());
    }
}
