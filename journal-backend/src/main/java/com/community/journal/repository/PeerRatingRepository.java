package com.community.journal.repository;

import com.community.journal.entity.PeerRating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;

@Repository
public interface PeerRatingRepository extends JpaRepository<PeerRating, Long> {

    boolean existsByFromUserIdAndEntryDate(Long fromUserId, LocalDate entryDate);

    // 累计打分次数（reviewer_100 徽章）
    long countByFromUserId(Long fromUserId);

    long countByEntryDate(LocalDate entryDate);
}
