package com.community.journal.repository;

import com.community.journal.entity.JournalEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

    /**
     * 查找某用户某天的记录（upsert 前置查询）
     */
    Optional<JournalEntry> findByUserIdAndEntryDate(Long userId, LocalDate entryDate);

    /**
     * 用户全部记录日期，升序（连续打卡计算用）
     */
    @Query("SELECT e.entryDate FROM JournalEntry e WHERE e.userId = :userId ORDER BY e.entryDate ASC")
    List<LocalDate> findEntryDatesByUserId(@Param("userId") Long userId);

    /**
     * 某天全部记录，按分数降序（日报 / 每日排行）
     */
    List<JournalEntry> findByEntryDateOrderByRatingDesc(LocalDate entryDate);

    Optional<JournalEntry> findFirstByUserIdOrderByEntryDateDesc(Long userId);

    long countByUserId(Long userId);

    List<JournalEntry> findByUserIdAndEntryDateBetweenOrderByEntryDateAsc(Long userId, LocalDate start, LocalDate end);

    @Query("SELECT AVG(e.rating) FROM JournalEntry e WHERE e.userId = :userId AND e.entryDate BETWEEN :start AND :end")
    Double averageRatingForRange(@Param("userId") Long userId,
                                 @Param("start") LocalDate start,
                                 @Param("end") LocalDate end);

    /**
     * 月度排行：[user_id, avg_rating, entry_count]，按平均分、参与次数降序
     */
    @Query("SELECT e.userId, AVG(e.rating), COUNT(e) FROM JournalEntry e " +
           "WHERE e.entryDate BETWEEN :start AND :end " +
           "GROUP BY e.userId " +
           "ORDER BY AVG(e.rating) DESC, COUNT(e) DESC")
    List<Object[]> findLeaderboardForRange(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
