package com.community.journal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 猜测结果，提交后揭晓作者与真实分数。
 * 未猜作者时 authorCorrect 为 null，未猜分数时 ratingCorrect / ratingExact 为 null。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GuessResultDTO {
    private Boolean authorCorrect;
    private Boolean ratingCorrect;   // 误差在容忍范围内（默认 ±1）
    private Boolean ratingExact;
    private Integer actualRating;
    private Long actualAuthorId;
    private String actualAuthorName;
    private Integer detectiveStreak;
    private boolean recorded;        // 猜测是否已持久化（失败不影响评分）
}
