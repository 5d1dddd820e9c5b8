package com.community.journal.controller;

import com.community.journal.dto.CommonResponse;
import com.community.journal.dto.DailyEntryDTO;
import com.community.journal.dto.DetectiveRankDTO;
import com.community.journal.dto.GuessStatsDTO;
import com.community.journal.dto.MonthlyLeaderboardItemDTO;
import com.community.journal.dto.RecapDTO;
import com.community.journal.dto.UserStatsDTO;
import com.community.journal.service.StatsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.community.journal.controller.EntryController.USER_HEADER;

@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/me")
    public ResponseEntity<CommonResponse<UserStatsDTO>> getMyStats(@RequestHeader(USER_HEADER) Long userId,
                                                                   @RequestParam(required = false) String month) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getMyStats(userId, month)));
    }

    @GetMapping("/me/guesses")
    public ResponseEntity<CommonResponse<GuessStatsDTO>> getGuessStats(@RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getGuessStats(userId)));
    }

    @GetMapping("/users/{user_id}")
    public ResponseEntity<CommonResponse<UserStatsDTO>> getUserStats(@PathVariable("user_id") Long userId,
                                                                     @RequestParam(required = false) String month) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getUserStats(userId, month)));
    }

    /**
     * GET /api/stats/recap?date=YYYY-MM-DD
     * 每日回顾，默认今天
     */
    @GetMapping("/recap")
    public ResponseEntity<CommonResponse<RecapDTO>> getDailyRecap(@RequestParam(required = false) String date) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getDailyRecap(date)));
    }

    @GetMapping("/detectives")
    public ResponseEntity<CommonResponse<List<DetectiveRankDTO>>> getDetectiveLeaderboard(
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getDetectiveLeaderboard(limit)));
    }

    @GetMapping("/daily")
    public ResponseEntity<CommonResponse<List<DailyEntryDTO>>> getDailyLeaderboard(
            @RequestParam(required = false) String date) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getDailyLeaderboard(date)));
    }

    @GetMapping("/monthly")
    public ResponseEntity<CommonResponse<List<MonthlyLeaderboardItemDTO>>> getMonthlyLeaderboard(
            @RequestParam(required = false) String month) {
        return ResponseEntity.ok(CommonResponse.success(statsService.getMonthlyLeaderboard(month)));
    }

    /**
     * POST /api/stats/monthly/{month}/champion
     * 月度定时任务调用：给该月排行第一的用户发放 top_1_monthly，可重复调用
     */
    @PostMapping("/monthly/{month}/champion")
    public ResponseEntity<CommonResponse<Long>> awardMonthlyChampion(@PathVariable String month) {
        return ResponseEntity.ok(CommonResponse.success(statsService.awardMonthlyChampion(month).orElse(null)));
    }
}
