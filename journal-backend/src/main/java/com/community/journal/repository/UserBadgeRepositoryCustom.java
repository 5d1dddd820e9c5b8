package com.community.journal.repository;

import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

public interface UserBadgeRepositoryCustom {

    /**
     * 幂等发放：唯一约束冲突视为"已拥有"。
     *
     * @return true 表示本次新发放
     */
    @Transactional
    boolean awardIfAbsent(Long userId, String badgeType, String metadataJson, LocalDateTime earnedAt);
}
