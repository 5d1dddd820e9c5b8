package com.community.journal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JournalEntry Entity: 每日记录表
 * 每个用户每天至多一条 (user_id, entry_date 唯一)，当天重复提交走更新。
 */
@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "journal_entry",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_entry_user_date", columnNames = {"user_id", "entry_date"})
        },
        indexes = {
                @Index(name = "idx_entry_date", columnList = "entry_date")
        })
@Check(constraints = "rating >= 0 AND rating <= 20")
public class JournalEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id")
    private Long entryId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    /**
     * 自评分数 0-20
     */
    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "comment", length = 2000)
    private String comment;

    /**
     * 标签，JSON 数组文本
     */
    @Convert(converter = EntryTagListConverter.class)
    @Column(name = "tags", length = 1000)
    private List<EntryTag> tags = new ArrayList<>();

    /**
     * 附件（GIF 链接）
     */
    @Column(name = "gif_url", length = 500)
    private String gifUrl;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
