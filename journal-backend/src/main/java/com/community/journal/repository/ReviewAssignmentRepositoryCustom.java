package com.community.journal.repository;

import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * 分配表的受约束插入。JPA 的 save 在唯一约束冲突时会污染持久化上下文，
 * 因此这里直接走 JdbcTemplate。
 */
public interface ReviewAssignmentRepositoryCustom {

    /**
     * 尝试插入一条分配记录。
     *
     * @return true 插入成功；false 表示 (reviewer, date) 或 (reviewee, date) 已被占用
     */
    @Transactional
    boolean tryCreate(Long reviewerId, Long revieweeId, LocalDate entryDate);
}
