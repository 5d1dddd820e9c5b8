package com.community.journal.dto;

import lombok.Data;

/**
 * 互评提交。guessedUserId / guessedRating 可选，带上任意一个即参与猜测。
 */
@Data
public class RatingRequest {
    private Long toUserId;        // 可选，给出时必须等于分配的被评人
    private String date;          // YYYY-MM-DD，必须是昨天
    private Integer rating;
    private Long guessedUserId;
    private Integer guessedRating;
}
