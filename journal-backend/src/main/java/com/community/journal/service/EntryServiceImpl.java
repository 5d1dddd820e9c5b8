package com.community.journal.service;

import com.community.journal.config.JournalProperties;
import com.community.journal.dto.EntryRequest;
import com.community.journal.dto.GuessResultDTO;
import com.community.journal.dto.NextReviewDTO;
import com.community.journal.dto.RatingRequest;
import com.community.journal.dto.SaveEntryResultDTO;
import com.community.journal.dto.SaveRatingResultDTO;
import com.community.journal.dto.TodayEntryDTO;
import com.community.journal.entity.AppUser;
import com.community.journal.entity.AuthorGuess;
import com.community.journal.entity.EntryTag;
import com.community.journal.entity.JournalEntry;
import com.community.journal.entity.PeerRating;
import com.community.journal.entity.ReviewAssignment;
import com.community.journal.exception.AssignmentConflictException;
import com.community.journal.exception.NotFoundException;
import com.community.journal.exception.ValidationException;
import com.community.journal.repository.AppUserRepository;
import com.community.journal.repository.AuthorGuessRepository;
import com.community.journal.repository.JournalEntryRepository;
import com.community.journal.repository.PeerRatingRepository;
import com.community.journal.repository.ReviewAssignmentRepository;
import com.community.journal.stats.JournalCalendar;
import com.community.journal.stats.StreakCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 每日记录与匿名互评。
 *
 * 【分配】
 * 评价者与被评价者在同一天都最多出现一次，由 review_assignment 的两个唯一约束保证；
 * 查询出的候选只是"可能空闲"，真正的占位以插入成功为准。
 * 插入冲突后先看自己是否已被分配（同一用户的并发请求），没有则说明候选被别人抢走，整体重试一次。
 *
 * 【评分与猜测】
 * 评分单独提交；猜测在评分成功之后尽力写入，写入失败只记日志，不回滚评分。
 *
 * 该类不开启外层事务：每次写操作各自提交，唯一约束冲突不会污染后续步骤。
 */
@Service
public class EntryServiceImpl implements EntryService {

    private static final Logger log = LoggerFactory.getLogger(EntryServiceImpl.class);

    // 选取候选 + 插入 的最大尝试次数
    static final int MAX_ASSIGNMENT_ATTEMPTS = 2;

    private final JournalEntryRepository entryRepository;
    private final ReviewAssignmentRepository assignmentRepository;
    private final PeerRatingRepository ratingRepository;
    private final AuthorGuessRepository guessRepository;
    private final AppUserRepository userRepository;
    private final BadgeService badgeService;
    private final EntryInputValidator validator;
    private final StreakCalculator streakCalculator;
    private final JournalCalendar calendar;
    private final JournalProperties properties;
    private final Clock clock;

    public EntryServiceImpl(JournalEntryRepository entryRepository,
                            ReviewAssignmentRepository assignmentRepository,
                            PeerRatingRepository ratingRepository,
                            AuthorGuessRepository guessRepository,
                            AppUserRepository userRepository,
                            BadgeService badgeService,
                            EntryInputValidator validator,
                            StreakCalculator streakCalculator,
                            JournalCalendar calendar,
                            JournalProperties properties,
                            Clock clock) {
        this.entryRepository = entryRepository;
        this.assignmentRepository = assignmentRepository;
        this.ratingRepository = ratingRepository;
        this.guessRepository = guessRepository;
        this.userRepository = userRepository;
        this.badgeService = badgeService;
        this.validator = validator;
        this.streakCalculator = streakCalculator;
        this.calendar = calendar;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public SaveEntryResultDTO saveEntry(Long userId, EntryRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        int rating = validator.requireRating(request.getRating(), "rating");
        String comment = validator.normalizeComment(request.getComment());
        List<EntryTag> tags = validator.normalizeTags(request.getTags());
        String gifUrl = validator.normalizeGifUrl(request.getGifUrl());
        requireUser(userId);

        LocalDate today = calendar.today();
        LocalDateTime now = LocalDateTime.now(clock);
        boolean isUpdate;

        Optional<JournalEntry> existing = entryRepository.findByUserIdAndEntryDate(userId, today);
        if (existing.isPresent()) {
            applyContent(existing.get(), rating, comment, tags, gifUrl, now);
            entryRepository.save(existing.get());
            isUpdate = true;
            log.debug("Entry updated: user={}, date={}, rating={}", userId, today, rating);
        } else {
            JournalEntry entry = new JournalEntry();
            entry.setUserId(userId);
            entry.setEntryDate(today);
            entry.setCreatedAt(now);
            applyContent(entry, rating, comment, tags, gifUrl, now);
            try {
                entryRepository.saveAndFlush(entry);
                isUpdate = false;
                log.info("Entry created: user={}, date={}, rating={}", userId, today, rating);
            } catch (DataIntegrityViolationException e) {
                // 同一用户并发提交：对方先插入成功，改为更新
                JournalEntry winner = entryRepository.findByUserIdAndEntryDate(userId, today).orElseThrow(() -> e);
                applyContent(winner, rating, comment, tags, gifUrl, now);
                entryRepository.save(winner);
                isUpdate = true;
                log.warn("Concurrent entry insert for user={}, date={}; updated the existing row", userId, today);
            }
        }

        List<String> newBadges = badgeService.evaluateBadges(userId);
        return new SaveEntryResultDTO(isUpdate, newBadges);
    }

    @Override
    public TodayEntryDTO getTodayEntry(Long userId) {
        requireUser(userId);
        return entryRepository.findByUserIdAndEntryDate(userId, calendar.today())
                .map(EntryServiceImpl::toTodayEntry)
                .orElseGet(TodayEntryDTO::absent);
    }

    @Override
    public NextReviewDTO getNextReview(Long userId) {
        requireUser(userId);
        LocalDate yesterday = calendar.yesterday();

        // 1. 昨天已经评过
        if (ratingRepository.existsByFromUserIdAndEntryDate(userId, yesterday)) {
            return NextReviewDTO.finished();
        }

        // 2. 已有分配，原样返回
        Optional<ReviewAssignment> existing = assignmentRepository.findByReviewerIdAndEntryDate(userId, yesterday);
        if (existing.isPresent()) {
            log.debug("Assignment reused: reviewer={}, reviewee={}, date={}",
                    userId, existing.get().getRevieweeId(), yesterday);
            return toReview(existing.get().getRevieweeId(), yesterday);
        }

        // 3. 随机选取并占位
        for (int attempt = 1; attempt <= MAX_ASSIGNMENT_ATTEMPTS; attempt++) {
            Optional<Long> candidate = assignmentRepository.findRandomUnassignedAuthor(userId, yesterday);
            if (candidate.isEmpty()) {
                return NextReviewDTO.finished();
            }

            Long revieweeId = candidate.get();
            if (assignmentRepository.tryCreate(userId, revieweeId, yesterday)) {
                log.info("Assignment created: reviewer={}, reviewee={}, date={}", userId, revieweeId, yesterday);
                return toReview(revieweeId, yesterday);
            }

            // 冲突：可能是自己的并发请求先占了位
            Optional<ReviewAssignment> mine = assignmentRepository.findByReviewerIdAndEntryDate(userId, yesterday);
            if (mine.isPresent()) {
                log.warn("Concurrent assignment for reviewer={} on {}; returning the winning assignment", userId, yesterday);
                return toReview(mine.get().getRevieweeId(), yesterday);
            }
            log.debug("Candidate {} was taken by another reviewer (attempt {}/{})", revieweeId, attempt, MAX_ASSIGNMENT_ATTEMPTS);
        }

        throw new AssignmentConflictException("Could not assign an entry to review, please retry");
    }

    @Override
    public SaveRatingResultDTO saveRating(Long fromUserId, RatingRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        LocalDate yesterday = calendar.yesterday();
        LocalDate date = JournalCalendar.parseDate(request.getDate());
        if (!date.equals(yesterday)) {
            throw new ValidationException("Only yesterday's entries can be rated");
        }
        int rating = validator.requireRating(request.getRating(), "rating");
        requireUser(fromUserId);

        if (ratingRepository.existsByFromUserIdAndEntryDate(fromUserId, date)) {
            throw new ValidationException("You already rated an entry for " + date);
        }
        ReviewAssignment assignment = assignmentRepository.findByReviewerIdAndEntryDate(fromUserId, date)
                .orElseThrow(() -> new ValidationException("No entry was assigned to you for " + date));
        // 被评人由分配决定；旧客户端仍会带上 toUserId，带了就必须一致
        if (request.getToUserId() != null && !assignment.getRevieweeId().equals(request.getToUserId())) {
            throw new ValidationException("toUserId does not match the entry assigned to you");
        }

        Long revieweeId = assignment.getRevieweeId();
        Long guessedUserId = request.getGuessedUserId();
        Integer guessedRating = request.getGuessedRating();
        if (guessedUserId != null && !userRepository.existsById(guessedUserId)) {
            throw new NotFoundException("Guessed user not found: " + guessedUserId);
        }
        if (guessedRating != null) {
            validator.requireRating(guessedRating, "guessedRating");
        }
        JournalEntry entry = entryRepository.findByUserIdAndEntryDate(revieweeId, date)
                .orElseThrow(() -> new NotFoundException("Entry not found for user " + revieweeId + " on " + date));

        PeerRating peerRating = new PeerRating();
        peerRating.setFromUserId(fromUserId);
        peerRating.setToUserId(revieweeId);
        peerRating.setEntryDate(date);
        peerRating.setRating(rating);
        peerRating.setCreatedAt(LocalDateTime.now(clock));
        try {
            ratingRepository.saveAndFlush(peerRating);
        } catch (DataIntegrityViolationException e) {
            throw new ValidationException("You already rated an entry for " + date);
        }
        log.info("Rating saved: from={}, to={}, date={}, rating={}", fromUserId, revieweeId, date, rating);

        GuessResultDTO guessResult = null;
        if (guessedUserId != null || guessedRating != null) {
            guessResult = recordGuess(fromUserId, entry, guessedUserId, guessedRating);
        }

        List<String> newBadges = badgeService.evaluateBadges(fromUserId);
        List<String> authorBadges = badgeService.evaluateBadges(revieweeId);
        if (!authorBadges.isEmpty()) {
            log.info("Author {} earned badges after being rated: {}", revieweeId, authorBadges);
        }
        return new SaveRatingResultDTO(newBadges, guessResult);
    }

    /**
     * 计算猜测结果并尽力落库。评分此时已提交，这里的失败只影响 recorded 标记。
     */
    private GuessResultDTO recordGuess(Long guesserId, JournalEntry entry, Long guessedUserId, Integer guessedRating) {
        Long authorId = entry.getUserId();
        int actualRating = entry.getRating();

        AuthorGuess guess = new AuthorGuess();
        guess.setGuesserId(guesserId);
        guess.setEntryUserId(authorId);
        guess.setEntryDate(entry.getEntryDate());
        guess.setGuessedUserId(guessedUserId);
        guess.setGuessedRating(guessedRating);
        guess.setActualRating(actualRating);
        guess.setAuthorCorrect(guessedUserId == null ? null : guessedUserId.equals(authorId));
        if (guessedRating != null) {
            int diff = Math.abs(guessedRating - actualRating);
            guess.setRatingCorrect(diff <= properties.getGuessTolerance());
            guess.setRatingExact(diff == 0);
        }
        guess.setCreatedAt(LocalDateTime.now(clock));

        boolean recorded = false;
        if (guessRepository.existsByGuesserIdAndEntryDate(guesserId, entry.getEntryDate())) {
            log.warn("Guess already recorded for guesser={} on {}", guesserId, entry.getEntryDate());
        } else {
            try {
                guessRepository.saveAndFlush(guess);
                recorded = true;
            } catch (DataAccessException e) {
                log.warn("Guess not recorded for guesser={} on {}, rating kept", guesserId, entry.getEntryDate(), e);
            }
        }

        GuessResultDTO result = new GuessResultDTO();
        result.setAuthorCorrect(guess.getAuthorCorrect());
        result.setRatingCorrect(guess.getRatingCorrect());
        result.setRatingExact(guess.getRatingExact());
        result.setActualRating(actualRating);
        result.setActualAuthorId(authorId);
        result.setActualAuthorName(userRepository.findById(authorId).map(AppUser::getUsername).orElse(null));
        result.setDetectiveStreak(streakCalculator.detectiveStreak(guessRepository.findAuthorOutcomes(guesserId)));
        result.setRecorded(recorded);
        return result;
    }

    private NextReviewDTO toReview(Long revieweeId, LocalDate date) {
        JournalEntry entry = entryRepository.findByUserIdAndEntryDate(revieweeId, date)
                .orElseThrow(() -> new NotFoundException("Entry not found for user " + revieweeId + " on " + date));
        NextReviewDTO dto = new NextReviewDTO();
        dto.setDone(false);
        dto.setDate(date);
        dto.setComment(entry.getComment());
        dto.setTags(tagIds(entry.getTags()));
        dto.setGifUrl(entry.getGifUrl());
        return dto;
    }

    private void applyContent(JournalEntry entry, int rating, String comment, List<EntryTag> tags,
                              String gifUrl, LocalDateTime now) {
        entry.setRating(rating);
        entry.setComment(comment);
        entry.setTags(tags);
        entry.setGifUrl(gifUrl);
        entry.setUpdatedAt(now);
    }

    private void requireUser(Long userId) {
        if (userId == null || !userRepository.existsById(userId)) {
            throw new NotFoundException("User not found: " + userId);
        }
    }

    static TodayEntryDTO toTodayEntry(JournalEntry entry) {
        TodayEntryDTO dto = new TodayEntryDTO();
        dto.setExists(true);
        dto.setRating(entry.getRating());
        dto.setComment(entry.getComment());
        dto.setTags(tagIds(entry.getTags()));
        dto.setGifUrl(entry.getGifUrl());
        return dto;
    }

    static List<String> tagIds(List<EntryTag> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream().map(EntryTag::getId).collect(Collectors.toList());
    }
}
