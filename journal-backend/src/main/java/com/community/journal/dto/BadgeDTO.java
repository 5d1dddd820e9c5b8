package com.community.journal.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

@Data
public class BadgeDTO {
    private String id;               // 徽章标识，如 streak_7
    private String name;
    private String description;
    private String icon;
    private Integer requirement;     // 无数值门槛为 null
    private LocalDateTime earnedAt;  // 仅用户已获得的徽章
    private Map<String, Object> metadata;
}
