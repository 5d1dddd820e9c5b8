package com.community.journal.repository;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDateTime;

public class UserBadgeRepositoryCustomImpl implements UserBadgeRepositoryCustom {

    private static final String INSERT_SQL =
            "INSERT INTO user_badge (user_id, badge_type, metadata, earned_at) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public UserBadgeRepositoryCustomImpl(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean awardIfAbsent(Long userId, String badgeType, String metadataJson, LocalDateTime earnedAt) {
        try {
            return jdbcTemplate.update(INSERT_SQL, userId, badgeType, metadataJson, earnedAt) == 1;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }
}
