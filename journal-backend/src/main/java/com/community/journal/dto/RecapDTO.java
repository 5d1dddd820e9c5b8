package com.community.journal.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * 每日回顾
 */
@Data
public class RecapDTO {
    private LocalDate date;
    private Integer participantCount;
    private Double avgRating;          // 一位小数，无人参与为 0
    private List<DailyEntryDTO> top3;
    private Long ratingsGiven;         // 当天被打出的互评数
}
