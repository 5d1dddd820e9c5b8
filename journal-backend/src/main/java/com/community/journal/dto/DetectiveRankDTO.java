package com.community.journal.dto;

import lombok.Data;

@Data
public class DetectiveRankDTO {
    private Integer rank;
    private Long userId;
    private String username;
    private long totalGuesses;
    private long correctGuesses;
    private int accuracy;
}
