package com.community.journal.repository;

import com.community.journal.entity.AuthorGuess;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public interface AuthorGuessRepository extends JpaRepository<AuthorGuess, Long> {

    boolean existsByGuesserIdAndEntryDate(Long guesserId, LocalDate entryDate);

    long countByGuesserIdAndAuthorCorrectTrue(Long guesserId);

    /**
     * 只包含猜了作者的记录（只猜分数的不参与侦探连胜）
     */
    List<AuthorGuess> findByGuesserIdAndAuthorCorrectIsNotNullOrderByEntryDateDesc(Long guesserId);

    /**
     * 侦探排行：[guesser_id, total, correct]，只统计猜了作者的记录
     */
    @Query("SELECT g.guesserId, COUNT(g), SUM(CASE WHEN g.authorCorrect = true THEN 1 ELSE 0 END) " +
           "FROM AuthorGuess g WHERE g.authorCorrect IS NOT NULL " +
           "GROUP BY g.guesserId")
    List<Object[]> findGuessTotalsPerUser();

    /**
     * 日期 -> 是否猜中作者，最新在前（侦探连胜计算用）
     */
    default Map<LocalDate, Boolean> findAuthorOutcomes(Long guesserId) {
        Map<LocalDate, Boolean> outcomes = new LinkedHashMap<>();
        for (AuthorGuess guess : findByGuesserIdAndAuthorCorrectIsNotNullOrderByEntryDateDesc(guesserId)) {
            outcomes.put(guess.getEntryDate(), guess.getAuthorCorrect());
        }
        return outcomes;
    }
}
