package com.community.journal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * journal.* 配置项（application.yml）
 */
@Data
@ConfigurationProperties(prefix = "journal")
public class JournalProperties {

    /**
     * "今天 / 昨天" 的计算时区
     */
    private String zone = "Europe/Paris";

    private int ratingMin = 0;

    private int ratingMax = 20;

    private int maxTags = 5;

    private int maxCommentLength = 2000;

    private int maxGifUrlLength = 500;

    /**
     * 猜分数的容差（|guess - actual| <= tolerance 记为猜中）
     */
    private int guessTolerance = 1;

    private List<String> corsAllowedOrigins = new ArrayList<>(List.of("http://localhost:5173"));
}
