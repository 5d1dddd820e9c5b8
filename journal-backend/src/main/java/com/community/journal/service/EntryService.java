package com.community.journal.service;

import com.community.journal.dto.EntryRequest;
import com.community.journal.dto.NextReviewDTO;
import com.community.journal.dto.RatingRequest;
import com.community.journal.dto.SaveEntryResultDTO;
import com.community.journal.dto.SaveRatingResultDTO;
import com.community.journal.dto.TodayEntryDTO;

/**
 * 每日记录与匿名互评。
 * 每个 (用户, 日期) 的互评状态：未分配 -> 已分配 -> 已评分，只能前进。
 */
public interface EntryService {

    /**
     * 写入或覆盖今天的记录
     */
    SaveEntryResultDTO saveEntry(Long userId, EntryRequest request);

    TodayEntryDTO getTodayEntry(Long userId);

    /**
     * 获取昨天需要评价的匿名记录（没有分配则随机分配一条，已分配则原样返回）
     */
    NextReviewDTO getNextReview(Long userId);

    SaveRatingResultDTO saveRating(Long fromUserId, RatingRequest request);
}
