package com.community.journal.controller;

import com.community.journal.dto.CommonResponse;
import com.community.journal.dto.EntryRequest;
import com.community.journal.dto.NextReviewDTO;
import com.community.journal.dto.RatingRequest;
import com.community.journal.dto.SaveEntryResultDTO;
import com.community.journal.dto.SaveRatingResultDTO;
import com.community.journal.dto.TodayEntryDTO;
import com.community.journal.service.EntryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 调用者身份由 X-User-Id 请求头给出（认证在网关层完成）。
 */
@RestController
@RequestMapping("/api")
public class EntryController {

    public static final String USER_HEADER = "X-User-Id";

    private final EntryService entryService;

    public EntryController(EntryService entryService) {
        this.entryService = entryService;
    }

    /**
     * POST /api/entries
     * 写入或覆盖今天的记录
     */
    @PostMapping("/entries")
    public ResponseEntity<CommonResponse<SaveEntryResultDTO>> saveEntry(@RequestHeader(USER_HEADER) Long userId,
                                                                        @RequestBody EntryRequest request) {
        return ResponseEntity.ok(CommonResponse.success(entryService.saveEntry(userId, request)));
    }

    @GetMapping("/entries/today")
    public ResponseEntity<CommonResponse<TodayEntryDTO>> getTodayEntry(@RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(CommonResponse.success(entryService.getTodayEntry(userId)));
    }

    /**
     * GET /api/review/next
     * 昨天分配给自己的匿名记录；没有可评价的记录时 done=true
     */
    @GetMapping("/review/next")
    public ResponseEntity<CommonResponse<NextReviewDTO>> getNextReview(@RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(CommonResponse.success(entryService.getNextReview(userId)));
    }

    @PostMapping("/ratings")
    public ResponseEntity<CommonResponse<SaveRatingResultDTO>> saveRating(@RequestHeader(USER_HEADER) Long userId,
                                                                          @RequestBody RatingRequest request) {
        return ResponseEntity.ok(CommonResponse.success(entryService.saveRating(userId, request)));
    }
}
