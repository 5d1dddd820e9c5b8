package com.community.journal.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * AuthorGuess Entity: 猜作者 / 猜分数记录表
 * 每个猜测者每天至多一条 (guesser_id, entry_date 唯一)。
 * 正确性在写入时计算并落库；未猜的那一项对应字段为 null。
 */
@Entity
@Data
@Table(name = "author_guess",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_guess_guesser_date", columnNames = {"guesser_id", "entry_date"})
        })
public class AuthorGuess {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "guess_id")
    private Long guessId;

    @Column(name = "guesser_id", nullable = false)
    private Long guesserId;

    /**
     * 被评价记录的真实作者
     */
    @Column(name = "entry_user_id", nullable = false)
    private Long entryUserId;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "guessed_user_id")
    private Long guessedUserId;

    @Column(name = "guessed_rating")
    private Integer guessedRating;

    @Column(name = "actual_rating", nullable = false)
    private Integer actualRating;

    @Column(name = "author_correct")
    private Boolean authorCorrect;

    /**
     * 误差在容差范围内（默认 ±1）
     */
    @Column(name = "rating_correct")
    private Boolean ratingCorrect;

    @Column(name = "rating_exact")
    private Boolean ratingExact;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
