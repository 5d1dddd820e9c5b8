package com.community.journal.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

public class ReviewAssignmentRepositoryCustomImpl implements ReviewAssignmentRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(ReviewAssignmentRepositoryCustomImpl.class);

    private static final String INSERT_SQL =
            "INSERT INTO review_assignment (reviewer_id, reviewee_id, entry_date, created_at) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ReviewAssignmentRepositoryCustomImpl(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public boolean tryCreate(Long reviewerId, Long revieweeId, LocalDate entryDate) {
        try {
            jdbcTemplate.update(INSERT_SQL, reviewerId, revieweeId, entryDate, LocalDateTime.now(clock));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("分配冲突: reviewer={}, reviewee={}, date={}", reviewerId, revieweeId, entryDate);
            return false;
        }
    }
}
