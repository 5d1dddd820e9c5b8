package com.community.journal.dto;

import lombok.Data;

@Data
public class GuessStatsDTO {
    private long totalGuesses;
    private long correctGuesses;
    private int accuracy;            // 百分比，四舍五入
    private int currentStreak;
    private int longestStreak;
}
