package com.community.journal.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 每日记录可选标签（封闭集合）。
 * 持久化和 API 中均使用小写 id，未知 id 在服务层直接拒绝。
 */
public enum EntryTag {

    // 工作
    PRODUCTIVE("productive"),
    USEFUL_MEETING("useful_meeting"),
    PROJECT_PROGRESS("project_progress"),
    RECOGNITION("recognition"),
    OVERLOAD("overload"),
    USELESS_MEETING("useless_meeting"),
    WORK_CONFLICT("work_conflict"),
    DEADLINE("deadline"),

    // 社交
    GOOD_EXCHANGES("good_exchanges"),
    PARTY("party"),
    FAMILY_TIME("family_time"),
    NEW_CONTACTS("new_contacts"),
    SOCIAL_CONFLICT("social_conflict"),
    LONELINESS("loneliness"),
    MISUNDERSTANDING("misunderstanding"),

    // 身体
    SPORT("sport"),
    GOOD_SLEEP("good_sleep"),
    ENERGY("energy"),
    SICK("sick"),
    TIRED("tired"),
    BAD_SLEEP("bad_sleep"),
    PAIN("pain"),

    // 个人
    HOBBY("hobby"),
    ACCOMPLISHMENT("accomplishment"),
    RELAXATION("relaxation"),
    GOOD_NEWS("good_news"),
    PROCRASTINATION("procrastination"),
    ANXIETY("anxiety"),
    BAD_NEWS("bad_news"),

    // 外部
    GOOD_WEATHER("good_weather"),
    WEEKEND("weekend"),
    BAD_WEATHER("bad_weather"),
    TRANSPORT_ISSUES("transport_issues"),
    UNEXPECTED("unexpected");

    private final String id;

    EntryTag(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static Optional<EntryTag> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(tag -> tag.id.equals(normalized))
                .findFirst();
    }
}
