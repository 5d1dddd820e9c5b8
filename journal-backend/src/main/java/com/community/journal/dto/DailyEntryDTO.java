package com.community.journal.dto;

import lombok.Data;

import java.util.List;

/**
 * 某天的一条记录（日报 top3 / 每日排行）
 */
@Data
public class DailyEntryDTO {
    private Integer rank;         // 仅每日排行使用
    private Long userId;
    private String username;
    private Integer rating;
    private String comment;
    private List<String> tags;
}
