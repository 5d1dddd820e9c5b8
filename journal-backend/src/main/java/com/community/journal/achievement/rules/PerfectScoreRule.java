package com.community.journal.achievement.rules;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.entity.BadgeType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * 打卡类：最近一条记录自评满分（perfect_20）
 */
@Component
public class PerfectScoreRule implements BadgeRule {

    private static final int PERFECT = 20;

    @Override
    public BadgeType getBadgeType() {
        return BadgeType.PERFECT_20;
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.getLastEntryRating() != null && context.getLastEntryRating() == PERFECT;
    }

    @Override
    public Map<String, Object> metadata(BadgeContext context) {
        String date = context.getLastEntryDate() == null ? null : context.getLastEntryDate().toString();
        return Collections.singletonMap("firstPerfectDate", date);
    }
}
