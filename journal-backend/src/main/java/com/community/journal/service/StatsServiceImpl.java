package com.community.journal.service;

import com.community.journal.dto.DailyEntryDTO;
import com.community.journal.dto.DetectiveRankDTO;
import com.community.journal.dto.GuessStatsDTO;
import com.community.journal.dto.MonthlyLeaderboardItemDTO;
import com.community.journal.dto.RecapDTO;
import com.community.journal.dto.TodayEntryDTO;
import com.community.journal.dto.UserStatsDTO;
import com.community.journal.entity.AppUser;
import com.community.journal.entity.JournalEntry;
import com.community.journal.exception.NotFoundException;
import com.community.journal.exception.ValidationException;
import com.community.journal.repository.AppUserRepository;
import com.community.journal.repository.AuthorGuessRepository;
import com.community.journal.repository.JournalEntryRepository;
import com.community.journal.repository.PeerRatingRepository;
import com.community.journal.stats.JournalCalendar;
import com.community.journal.stats.MonthRange;
import com.community.journal.stats.StatsCalculator;
import com.community.journal.stats.StreakCalculator;
import com.community.journal.stats.StreakResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class StatsServiceImpl implements StatsService {

    private static final Logger log = LoggerFactory.getLogger(StatsServiceImpl.class);

    private static final int DEFAULT_DETECTIVE_LIMIT = 10;
    private static final int MAX_DETECTIVE_LIMIT = 100;
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final JournalEntryRepository entryRepository;
    private final PeerRatingRepository ratingRepository;
    private final AuthorGuessRepository guessRepository;
    private final AppUserRepository userRepository;
    private final BadgeService badgeService;
    private final StreakCalculator streakCalculator;
    private final StatsCalculator statsCalculator;
    private final JournalCalendar calendar;

    public StatsServiceImpl(JournalEntryRepository entryRepository,
                            PeerRatingRepository ratingRepository,
                            AuthorGuessRepository guessRepository,
                            AppUserRepository userRepository,
                            BadgeService badgeService,
                            StreakCalculator streakCalculator,
                            StatsCalculator statsCalculator,
                            JournalCalendar calendar) {
        this.entryRepository = entryRepository;
        this.ratingRepository = ratingRepository;
        this.guessRepository = guessRepository;
        this.userRepository = userRepository;
        this.badgeService = badgeService;
        this.streakCalculator = streakCalculator;
        this.statsCalculator = statsCalculator;
        this.calendar = calendar;
    }

    @Override
    public UserStatsDTO getMyStats(Long userId, String month) {
        return buildUserStats(requireUser(userId), month);
    }

    @Override
    public UserStatsDTO getUserStats(Long userId, String month) {
        return buildUserStats(requireUser(userId), month);
    }

    @Override
    public RecapDTO getDailyRecap(String date) {
        // 默认今天：昨天的记录还在匿名互评中，不能提前公开作者
        LocalDate day = (date == null || date.isBlank()) ? calendar.today() : JournalCalendar.parseDate(date);
        List<DailyEntryDTO> entries = dailyEntries(day);
        return statsCalculator.recap(day, entries, ratingRepository.countByEntryDate(day));
    }

    @Override
    public GuessStatsDTO getGuessStats(Long userId) {
        requireUser(userId);
        Map<LocalDate, Boolean> outcomes = guessRepository.findAuthorOutcomes(userId);
        long correct = outcomes.values().stream().filter(Boolean.TRUE::equals).count();

        GuessStatsDTO dto = new GuessStatsDTO();
        dto.setTotalGuesses(outcomes.size());
        dto.setCorrectGuesses(correct);
        dto.setAccuracy(statsCalculator.percent(correct, outcomes.size()));
        dto.setCurrentStreak(streakCalculator.detectiveStreak(outcomes));
        dto.setLongestStreak(streakCalculator.longestDetectiveStreak(outcomes));
        return dto;
    }

    @Override
    public List<DetectiveRankDTO> getDetectiveLeaderboard(Integer limit) {
        int size = (limit == null || limit <= 0) ? DEFAULT_DETECTIVE_LIMIT : Math.min(limit, MAX_DETECTIVE_LIMIT);

        List<DetectiveRankDTO> ranking = new ArrayList<>();
        for (Object[] row : guessRepository.findGuessTotalsPerUser()) {
            DetectiveRankDTO dto = new DetectiveRankDTO();
            dto.setUserId(((Number) row[0]).longValue());
            dto.setTotalGuesses(((Number) row[1]).longValue());
            dto.setCorrectGuesses(row[2] == null ? 0 : ((Number) row[2]).longValue());
            dto.setAccuracy(statsCalculator.percent(dto.getCorrectGuesses(), dto.getTotalGuesses()));
            ranking.add(dto);
        }
        ranking.sort(Comparator.comparingInt(DetectiveRankDTO::getAccuracy).reversed()
                .thenComparing(Comparator.comparingLong(DetectiveRankDTO::getCorrectGuesses).reversed())
                .thenComparing(DetectiveRankDTO::getUserId));

        List<DetectiveRankDTO> top = ranking.stream().limit(size).collect(Collectors.toList());
        Map<Long, String> names = usernames(top.stream().map(DetectiveRankDTO::getUserId).collect(Collectors.toSet()));
        for (int i = 0; i < top.size(); i++) {
            top.get(i).setRank(i + 1);
            top.get(i).setUsername(names.get(top.get(i).getUserId()));
        }
        return top;
    }

    @Override
    public List<DailyEntryDTO> getDailyLeaderboard(String date) {
        LocalDate day = (date == null || date.isBlank()) ? calendar.today() : JournalCalendar.parseDate(date);
        List<DailyEntryDTO> entries = dailyEntries(day);
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setRank(i + 1);
        }
        return entries;
    }

    @Override
    public List<MonthlyLeaderboardItemDTO> getMonthlyLeaderboard(String month) {
        MonthRange range = calendar.monthRange(month);
        List<Object[]> rows = entryRepository.findLeaderboardForRange(range.getMonthStart(), range.getMonthEnd());

        Set<Long> userIds = new HashSet<>();
        for (Object[] row : rows) {
            userIds.add(((Number) row[0]).longValue());
        }
        Map<Long, String> names = usernames(userIds);

        List<MonthlyLeaderboardItemDTO> result = new ArrayList<>();
        int rank = 1;
        for (Object[] row : rows) {
            MonthlyLeaderboardItemDTO dto = new MonthlyLeaderboardItemDTO();
            dto.setRank(rank++);
            dto.setUserId(((Number) row[0]).longValue());
            dto.setUsername(names.get(dto.getUserId()));
            dto.setAvgRating(statsCalculator.normalizeAverage(((Number) row[1]).doubleValue()));
            dto.setEntryCount(((Number) row[2]).longValue());
            result.add(dto);
        }
        return result;
    }

    @Override
    @Transactional
    public Optional<Long> awardMonthlyChampion(String month) {
        if (!JournalCalendar.isValidMonthFormat(month)) {
            throw new ValidationException("Month must use the YYYY-MM format");
        }
        MonthRange range = calendar.monthRange(month);
        String monthKey = range.getMonthStart().format(MONTH_FORMAT);
        if (!monthKey.equals(month)) {
            throw new ValidationException("Invalid month: " + month);
        }

        List<MonthlyLeaderboardItemDTO> leaderboard = getMonthlyLeaderboard(monthKey);
        if (leaderboard.isEmpty()) {
            log.info("No entries in {}, no monthly champion", monthKey);
            return Optional.empty();
        }
        Long championId = leaderboard.get(0).getUserId();
        if (badgeService.awardMonthlyTop(championId, monthKey)) {
            log.info("Monthly champion for {}: user={}", monthKey, championId);
        } else {
            log.debug("Monthly champion badge already held: user={}, month={}", championId, monthKey);
        }
        return Optional.of(championId);
    }

    private UserStatsDTO buildUserStats(AppUser user, String month) {
        Long userId = user.getUserId();
        LocalDate today = calendar.today();
        MonthRange range = calendar.monthRange(month);

        StreakResult streak = streakCalculator.calculate(entryRepository.findEntryDatesByUserId(userId), today);
        List<JournalEntry> monthEntries = entryRepository.findByUserIdAndEntryDateBetweenOrderByEntryDateAsc(
                userId, range.getMonthStart(), range.getMonthEnd());

        UserStatsDTO dto = new UserStatsDTO();
        dto.setUserId(userId);
        dto.setUsername(user.getUsername());
        dto.setToday(today);
        dto.setMonth(range);

        entryRepository.findFirstByUserIdOrderByEntryDateDesc(userId).ifPresent(last -> {
            dto.setLastEntry(toDailyEntry(last, user.getUsername()));
            dto.setLastEntryDate(last.getEntryDate());
        });
        dto.setTodayEntry(entryRepository.findByUserIdAndEntryDate(userId, today)
                .map(EntryServiceImpl::toTodayEntry)
                .orElseGet(TodayEntryDTO::absent));

        dto.setParticipationCount(entryRepository.countByUserId(userId));
        dto.setMonthAverage(statsCalculator.normalizeAverage(
                entryRepository.averageRatingForRange(userId, range.getMonthStart(), range.getMonthEnd())));
        dto.setMonthEntries(monthEntries.stream()
                .map(entry -> toDailyEntry(entry, user.getUsername()))
                .collect(Collectors.toList()));

        dto.setCurrentStreak(streak.getCurrentStreak());
        dto.setLongestStreak(streak.getLongestStreak());
        dto.setBadges(badgeService.getUserBadges(userId));
        dto.setBadgeProgress(badgeService.getBadgeProgress(userId, streak.getCurrentStreak()));
        return dto;
    }

    private List<DailyEntryDTO> dailyEntries(LocalDate day) {
        List<JournalEntry> entries = entryRepository.findByEntryDateOrderByRatingDesc(day);
        Map<Long, String> names = usernames(entries.stream().map(JournalEntry::getUserId).collect(Collectors.toSet()));
        return entries.stream()
                .map(entry -> toDailyEntry(entry, names.get(entry.getUserId())))
                .collect(Collectors.toList());
    }

    private DailyEntryDTO toDailyEntry(JournalEntry entry, String username) {
        DailyEntryDTO dto = new DailyEntryDTO();
        dto.setUserId(entry.getUserId());
        dto.setUsername(username);
        dto.setRating(entry.getRating());
        dto.setComment(entry.getComment());
        dto.setTags(EntryServiceImpl.tagIds(entry.getTags()));
        return dto;
    }

    private Map<Long, String> usernames(Collection<Long> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        return userRepository.findByUserIdIn(userIds).stream()
                .collect(Collectors.toMap(AppUser::getUserId, AppUser::getUsername));
    }

    private AppUser requireUser(Long userId) {
        if (userId == null) {
            throw new NotFoundException("User not found: null");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }
}
