package com.community.journal.service;

import com.community.journal.config.JournalProperties;
import com.community.journal.entity.EntryTag;
import com.community.journal.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 记录 / 评分输入校验，边界值来自 journal.* 配置。
 */
@Component
public class EntryInputValidator {

    private final JournalProperties properties;

    public EntryInputValidator(JournalProperties properties) {
        this.properties = properties;
    }

    public int requireRating(Integer rating, String field) {
        if (rating == null) {
            throw new ValidationException(field + " is required");
        }
        if (rating < properties.getRatingMin() || rating > properties.getRatingMax()) {
            throw new ValidationException(String.format("%s must be between %d and %d",
                    field, properties.getRatingMin(), properties.getRatingMax()));
        }
        return rating;
    }

    /**
     * 空白评论视为无评论
     */
    public String normalizeComment(String comment) {
        if (comment == null || comment.isBlank()) {
            return null;
        }
        if (comment.length() > properties.getMaxCommentLength()) {
            throw new ValidationException("Comment must not exceed " + properties.getMaxCommentLength() + " characters");
        }
        return comment;
    }

    /**
     * 未知标签直接拒绝，重复标签合并（保持首次出现顺序）
     */
    public List<EntryTag> normalizeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return new ArrayList<>();
        }
        Set<EntryTag> unique = new LinkedHashSet<>();
        for (String raw : tags) {
            EntryTag tag = EntryTag.fromId(raw)
                    .orElseThrow(() -> new ValidationException("Unknown tag: " + raw));
            unique.add(tag);
        }
        if (unique.size() > properties.getMaxTags()) {
            throw new ValidationException("At most " + properties.getMaxTags() + " tags are allowed");
        }
        return new ArrayList<>(unique);
    }

    public String normalizeGifUrl(String gifUrl) {
        if (gifUrl == null || gifUrl.isBlank()) {
            return null;
        }
        String url = gifUrl.trim();
        if (url.length() > properties.getMaxGifUrlLength()) {
            throw new ValidationException("GIF URL must not exceed " + properties.getMaxGifUrlLength() + " characters");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ValidationException("GIF URL must be an http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("GIF URL is not a valid URL");
        }
        return url;
    }
}
