package com.community.journal.achievement.rules;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.entity.BadgeType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * 猜测类：累计猜中作者 10 次（detective_10）
 */
@Component
public class DetectiveRule implements BadgeRule {

    @Override
    public BadgeType getBadgeType() {
        return BadgeType.DETECTIVE_10;
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.getCorrectGuesses() >= getBadgeType().getRequirement();
    }

    @Override
    public Map<String, Object> metadata(BadgeContext context) {
        return Collections.singletonMap("correctGuesses", context.getCorrectGuesses());
    }
}
