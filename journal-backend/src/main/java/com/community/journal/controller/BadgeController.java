package com.community.journal.controller;

import com.community.journal.dto.BadgeDTO;
import com.community.journal.dto.CommonResponse;
import com.community.journal.service.BadgeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.community.journal.controller.EntryController.USER_HEADER;

@RestController
@RequestMapping("/api/badges")
public class BadgeController {

    private final BadgeService badgeService;

    public BadgeController(BadgeService badgeService) {
        this.badgeService = badgeService;
    }

    // 全部徽章定义
    @GetMapping
    public ResponseEntity<CommonResponse<List<BadgeDTO>>> getBadgeDefinitions() {
        return ResponseEntity.ok(CommonResponse.success(badgeService.getBadgeDefinitions()));
    }

    @GetMapping("/me")
    public ResponseEntity<CommonResponse<List<BadgeDTO>>> getMyBadges(@RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(CommonResponse.success(badgeService.getUserBadges(userId)));
    }
}
