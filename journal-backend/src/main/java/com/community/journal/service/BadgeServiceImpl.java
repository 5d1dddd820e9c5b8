package com.community.journal.service;

import com.community.journal.achievement.BadgeContext;
import com.community.journal.achievement.BadgeRule;
import com.community.journal.dto.BadgeDTO;
import com.community.journal.dto.BadgeProgressDTO;
import com.community.journal.entity.BadgeType;
import com.community.journal.entity.JournalEntry;
import com.community.journal.entity.UserBadge;
import com.community.journal.exception.JournalException;
import com.community.journal.repository.AuthorGuessRepository;
import com.community.journal.repository.JournalEntryRepository;
import com.community.journal.repository.PeerRatingRepository;
import com.community.journal.repository.UserBadgeRepository;
import com.community.journal.stats.JournalCalendar;
import com.community.journal.stats.StreakCalculator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 徽章服务：收集所有注册的 BadgeRule，评估后写入 user_badge 表。
 * 新增徽章只需实现 BadgeRule 并注册为 Spring Bean。
 * 发放依赖 (user_id, badge_type) 唯一约束保证幂等，徽章一经发放永不撤销。
 */
@Service
@Transactional(readOnly = true)
public class BadgeServiceImpl implements BadgeService {

    private static final Logger log = LoggerFactory.getLogger(BadgeServiceImpl.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    // 有进度条的徽章
    private static final List<BadgeType> PROGRESS_BADGES = Arrays.asList(
            BadgeType.STREAK_7, BadgeType.STREAK_30, BadgeType.REVIEWER_100, BadgeType.DETECTIVE_10);

    private final List<BadgeRule> rules;
    private final UserBadgeRepository badgeRepository;
    private final JournalEntryRepository entryRepository;
    private final PeerRatingRepository ratingRepository;
    private final AuthorGuessRepository guessRepository;
    private final StreakCalculator streakCalculator;
    private final JournalCalendar calendar;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BadgeServiceImpl(List<BadgeRule> rules,
                            UserBadgeRepository badgeRepository,
                            JournalEntryRepository entryRepository,
                            PeerRatingRepository ratingRepository,
                            AuthorGuessRepository guessRepository,
                            StreakCalculator streakCalculator,
                            JournalCalendar calendar,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.rules = rules;
        this.badgeRepository = badgeRepository;
        this.entryRepository = entryRepository;
        this.ratingRepository = ratingRepository;
        this.guessRepository = guessRepository;
        this.streakCalculator = streakCalculator;
        this.calendar = calendar;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public List<String> evaluateBadges(Long userId) {
        BadgeContext context = buildContext(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<String> awarded = new ArrayList<>();
        for (BadgeRule rule : rules) {
            if (!rule.isSatisfied(context)) {
                continue;
            }
            String badgeId = rule.getBadgeType().getId();
            if (badgeRepository.awardIfAbsent(userId, badgeId, toJson(rule.metadata(context)), now)) {
                log.info("Badge awarded: user={}, badge={}", userId, badgeId);
                awarded.add(badgeId);
            } else {
                log.debug("徽章已拥有: user={}, badge={}", userId, badgeId);
            }
        }
        return awarded;
    }

    @Override
    public List<BadgeDTO> getUserBadges(Long userId) {
        List<BadgeDTO> result = new ArrayList<>();
        for (UserBadge badge : badgeRepository.findByUserIdOrderByEarnedAtDesc(userId)) {
            Optional<BadgeType> type = BadgeType.fromId(badge.getBadgeType());
            if (type.isEmpty()) {
                log.warn("Unknown badge type in user_badge: {}", badge.getBadgeType());
                continue;
            }
            BadgeDTO dto = toDefinition(type.get());
            dto.setEarnedAt(badge.getEarnedAt());
            dto.setMetadata(parseMetadata(badge));
            result.add(dto);
        }
        return result;
    }

    @Override
    public Map<String, BadgeProgressDTO> getBadgeProgress(Long userId, int currentStreak) {
        long ratingsGiven = ratingRepository.countByFromUserId(userId);
        long correctGuesses = guessRepository.countByGuesserIdAndAuthorCorrectTrue(userId);

        Map<String, BadgeProgressDTO> progress = new LinkedHashMap<>();
        for (BadgeType type : PROGRESS_BADGES) {
            long current;
            switch (type) {
                case REVIEWER_100:
                    current = ratingsGiven;
                    break;
                case DETECTIVE_10:
                    current = correctGuesses;
                    break;
                default:
                    current = currentStreak;
            }
            int target = type.getRequirement();
            int percent = (int) Math.min(100, current * 100 / target);
            progress.put(type.getId(), new BadgeProgressDTO(current, target, percent));
        }
        return progress;
    }

    @Override
    public List<BadgeDTO> getBadgeDefinitions() {
        return Arrays.stream(BadgeType.values())
                .map(this::toDefinition)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public boolean awardMonthlyTop(Long userId, String month) {
        String badgeId = BadgeType.TOP_1_MONTHLY.getId();
        boolean awarded = badgeRepository.awardIfAbsent(
                userId, badgeId, toJson(Collections.singletonMap("month", month)), LocalDateTime.now(clock));
        if (awarded) {
            log.info("Badge awarded: user={}, badge={}, month={}", userId, badgeId, month);
        }
        return awarded;
    }

    private BadgeContext buildContext(Long userId) {
        LocalDate today = calendar.today();
        List<LocalDate> dates = entryRepository.findEntryDatesByUserId(userId);
        Optional<JournalEntry> lastEntry = entryRepository.findFirstByUserIdOrderByEntryDateDesc(userId);

        return BadgeContext.builder()
                .userId(userId)
                .today(today)
                .currentStreak(streakCalculator.calculate(dates, today).getCurrentStreak())
                .lastEntryRating(lastEntry.map(JournalEntry::getRating).orElse(null))
                .lastEntryDate(lastEntry.map(JournalEntry::getEntryDate).orElse(null))
                .ratingsGiven(ratingRepository.countByFromUserId(userId))
                .correctGuesses(guessRepository.countByGuesserIdAndAuthorCorrectTrue(userId))
                .detectiveStreak(streakCalculator.detectiveStreak(guessRepository.findAuthorOutcomes(userId)))
                .build();
    }

    private BadgeDTO toDefinition(BadgeType type) {
        BadgeDTO dto = new BadgeDTO();
        dto.setId(type.getId());
        dto.setName(type.getDisplayName());
        dto.setDescription(type.getDescription());
        dto.setIcon(type.getIcon());
        dto.setRequirement(type.getRequirement());
        return dto;
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new JournalException("Failed to serialize badge metadata", "BADGE_METADATA_ERROR", e);
        }
    }

    private Map<String, Object> parseMetadata(UserBadge badge) {
        if (badge.getMetadata() == null || badge.getMetadata().isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(badge.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            // 元数据损坏不影响徽章本身的展示
            log.warn("Unreadable metadata for badge {} of user {}", badge.getBadgeType(), badge.getUserId(), e);
            return Collections.emptyMap();
        }
    }
}
