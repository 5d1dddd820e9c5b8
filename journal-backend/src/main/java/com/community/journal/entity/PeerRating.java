package com.community.journal.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Check;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * PeerRating Entity: 互评打分表
 * 每个评价者每天只能打一次分 (from_user_id, entry_date 唯一)，写入后不再修改。
 */
@Entity
@Data
@Table(name = "peer_rating",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_rating_from_date", columnNames = {"from_user_id", "entry_date"})
        },
        indexes = {
                @Index(name = "idx_rating_to_date", columnList = "to_user_id,entry_date")
        })
@Check(constraints = "rating >= 0 AND rating <= 20")
public class PeerRating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "rating_id")
    private Long ratingId;

    @Column(name = "from_user_id", nullable = false)
    private Long fromUserId;

    @Column(name = "to_user_id", nullable = false)
    private Long toUserId;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
