package com.community.journal.repository;

import com.community.journal.entity.ReviewAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReviewAssignmentRepository extends JpaRepository<ReviewAssignment, Long>, ReviewAssignmentRepositoryCustom {

    Optional<ReviewAssignment> findByReviewerIdAndEntryDate(Long reviewerId, LocalDate entryDate);

    List<ReviewAssignment> findByEntryDate(LocalDate entryDate);

    /**
     * 随机取一位当天尚未被分配出去的作者（排除评价者本人）。
     * 只是候选，真正的占位由 tryCreate 的唯一约束决定。
     */
    @Query(value = "SELECT e.user_id FROM journal_entry e " +
                   "WHERE e.entry_date = :entryDate " +
                   "  AND e.user_id <> :reviewerId " +
                   "  AND NOT EXISTS (" +
                   "    SELECT 1 FROM review_assignment ra " +
                   "    WHERE ra.reviewee_id = e.user_id AND ra.entry_date = :entryDate" +
                   "  ) " +
                   "ORDER BY RAND() " +
                   "LIMIT 1", nativeQuery = true)
    Optional<Long> findRandomUnassignedAuthor(@Param("reviewerId") Long reviewerId,
                                              @Param("entryDate") LocalDate entryDate);
}
