package com.community.journal.dto;

import lombok.Data;

@Data
public class MonthlyLeaderboardItemDTO {
    private Integer rank;
    private Long userId;
    private String username;
    private Double avgRating;
    private long entryCount;
}
