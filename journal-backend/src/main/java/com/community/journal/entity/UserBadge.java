package com.community.journal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * UserBadge Entity: 徽章发放表
 * (user_id, badge_type) 唯一，重复发放由唯一约束拦截，发放后永不撤销。
 */
@Entity
@Table(name = "user_badge",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_user_badge", columnNames = {"user_id", "badge_type"})
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserBadge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "badge_id")
    private Long badgeId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 徽章类型 id，对应 BadgeType#getId()
     */
    @Column(name = "badge_type", nullable = false, length = 50)
    private String badgeType;

    /**
     * 发放时的上下文（JSON），例如 {"streak":7}
     */
    @Column(name = "metadata", length = 1000)
    private String metadata;

    @Column(name = "earned_at", nullable = false)
    private LocalDateTime earnedAt;
}
