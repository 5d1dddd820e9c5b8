package com.community.journal.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * 徽章定义。requirement 为进度目标值，没有数值门槛的徽章为 null。
 */
public enum BadgeType {

    STREAK_7("streak_7", "7 days in a row", "First one-week streak", "🔥", 7),
    STREAK_30("streak_30", "Perfect month", "30 consecutive days", "🏆", 30),
    TOP_1_MONTHLY("top_1_monthly", "Top 1", "First place on the monthly leaderboard", "🥇", null),
    PERFECT_20("perfect_20", "20/20", "First perfect score", "⭐", null),
    REVIEWER_100("reviewer_100", "Reviewer", "100 ratings given", "📝", 100),
    DETECTIVE_10("detective_10", "Detective", "10 authors guessed correctly", "🔍", 10),
    DETECTIVE_STREAK_5("detective_streak_5", "Sherlock", "5 correct author guesses on consecutive days", "🕵️", 5);

    private final String id;
    private final String displayName;
    private final String description;
    private final String icon;
    private final Integer requirement;

    BadgeType(String id, String displayName, String description, String icon, Integer requirement) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.icon = icon;
        this.requirement = requirement;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getIcon() {
        return icon;
    }

    public Integer getRequirement() {
        return requirement;
    }

    public static Optional<BadgeType> fromId(String id) {
        return Arrays.stream(values())
                .filter(type -> type.id.equals(id))
                .findFirst();
    }
}
