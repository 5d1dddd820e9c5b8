package com.community.journal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * ReviewAssignment Entity: 匿名互评分配表
 * 同一天内 reviewer 唯一、reviewee 唯一（一对一匹配）。
 * 只插入不修改、不删除，作为历史审计记录保留。
 * 插入走 JDBC（见 ReviewAssignmentRepositoryCustomImpl），由唯一约束裁决并发冲突。
 */
@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "review_assignment",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_assignment_reviewer_date", columnNames = {"reviewer_id", "entry_date"}),
                @UniqueConstraint(name = "uk_assignment_reviewee_date", columnNames = {"reviewee_id", "entry_date"})
        })
public class ReviewAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "assignment_id")
    private Long assignmentId;

    @Column(name = "reviewer_id", nullable = false)
    private Long reviewerId;

    @Column(name = "reviewee_id", nullable = false)
    private Long revieweeId;

    /**
     * 被评价记录的日期（即"昨天"）
     */
    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
