package com.community.journal.service;

import com.community.journal.config.JournalProperties;
import com.community.journal.dto.EntryRequest;
import com.community.journal.dto.NextReviewDTO;
import com.community.journal.dto.RatingRequest;
import com.community.journal.dto.SaveEntryResultDTO;
import com.community.journal.dto.SaveRatingResultDTO;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EntryServiceImplTest {

    private static final LocalDate TODAY = LocalDate.parse("2024-01-15");
    private static final LocalDate YESTERDAY = LocalDate.parse("2024-01-14");

    @Mock
    private JournalEntryRepository entryRepository;

    @Mock
    private ReviewAssignmentRepository assignmentRepository;

    @Mock
    private PeerRatingRepository ratingRepository;

    @Mock
    private AuthorGuessRepository guessRepository;

    @Mock
    private AppUserRepository userRepository;

    @Mock
    private BadgeService badgeService;

    private EntryServiceImpl entryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("Europe/Paris"));
        JournalProperties properties = new JournalProperties();
        entryService = new EntryServiceImpl(entryRepository, assignmentRepository, ratingRepository,
                guessRepository, userRepository, badgeService, new EntryInputValidator(properties),
                new StreakCalculator(), new JournalCalendar(clock), properties, clock);
    }

    private static JournalEntry entry(Long userId, LocalDate date, int rating) {
        JournalEntry entry = new JournalEntry();
        entry.setEntryId(userId * 100);
        entry.setUserId(userId);
        entry.setEntryDate(date);
        entry.setRating(rating);
        entry.setComment("entry of " + userId);
        entry.setTags(new ArrayList<>(List.of(EntryTag.PRODUCTIVE)));
        entry.setCreatedAt(LocalDateTime.of(date, LocalTime.NOON));
        entry.setUpdatedAt(entry.getCreatedAt());
        return entry;
    }

    private static ReviewAssignment assignment(Long reviewerId, Long revieweeId) {
        ReviewAssignment assignment = new ReviewAssignment();
        assignment.setReviewerId(reviewerId);
        assignment.setRevieweeId(revieweeId);
        assignment.setEntryDate(YESTERDAY);
        return assignment;
    }

    private static RatingRequest ratingRequest(Long toUserId, String date, Integer rating) {
        RatingRequest request = new RatingRequest();
        request.setToUserId(toUserId);
        request.setDate(date);
        request.setRating(rating);
        return request;
    }

    private void stubValidRatingPreconditions() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY))
                .thenReturn(Optional.of(assignment(1L, 2L)));
    }

    // ---------------- getNextReview ----------------

    @Test
    void testGetNextReview_AlreadyRated() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(true);

        NextReviewDTO result = entryService.getNextReview(1L);

        assertTrue(result.isDone());
        assertNull(result.getComment());
        verifyNoInteractions(assignmentRepository);
    }

    @Test
    void testGetNextReview_ReusesExistingAssignment() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY))
                .thenReturn(Optional.of(assignment(1L, 2L)));
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 14)));

        NextReviewDTO result = entryService.getNextReview(1L);

        assertFalse(result.isDone());
        assertEquals(YESTERDAY, result.getDate());
        assertEquals("entry of 2", result.getComment());
        assertEquals(List.of("productive"), result.getTags());
        verify(assignmentRepository, never()).findRandomUnassignedAuthor(anyLong(), any());
        verify(assignmentRepository, never()).tryCreate(anyLong(), anyLong(), any());
    }

    @Test
    void testGetNextReview_NothingLeftToReview() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY)).thenReturn(Optional.empty());
        when(assignmentRepository.findRandomUnassignedAuthor(1L, YESTERDAY)).thenReturn(Optional.empty());

        assertTrue(entryService.getNextReview(1L).isDone());
        verify(assignmentRepository, never()).tryCreate(anyLong(), anyLong(), any());
    }

    @Test
    void testGetNextReview_CreatesAssignment() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY)).thenReturn(Optional.empty());
        when(assignmentRepository.findRandomUnassignedAuthor(1L, YESTERDAY)).thenReturn(Optional.of(3L));
        when(assignmentRepository.tryCreate(1L, 3L, YESTERDAY)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(3L, YESTERDAY)).thenReturn(Optional.of(entry(3L, YESTERDAY, 9)));

        NextReviewDTO result = entryService.getNextReview(1L);

        assertFalse(result.isDone());
        assertEquals("entry of 3", result.getComment());
    }

    // 候选被别人抢走：重新选一次
    @Test
    void testGetNextReview_CandidateTakenRetriesOnce() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY)).thenReturn(Optional.empty());
        when(assignmentRepository.findRandomUnassignedAuthor(1L, YESTERDAY))
                .thenReturn(Optional.of(2L), Optional.of(3L));
        when(assignmentRepository.tryCreate(1L, 2L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.tryCreate(1L, 3L, YESTERDAY)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(3L, YESTERDAY)).thenReturn(Optional.of(entry(3L, YESTERDAY, 9)));

        NextReviewDTO result = entryService.getNextReview(1L);

        assertEquals("entry of 3", result.getComment());
        verify(assignmentRepository, times(2)).findRandomUnassignedAuthor(1L, YESTERDAY);
    }

    // 同一用户的并发请求先占了位：返回那条分配
    @Test
    void testGetNextReview_ConcurrentRequestOfSameReviewer() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY))
                .thenReturn(Optional.empty(), Optional.of(assignment(1L, 4L)));
        when(assignmentRepository.findRandomUnassignedAuthor(1L, YESTERDAY)).thenReturn(Optional.of(2L));
        when(assignmentRepository.tryCreate(1L, 2L, YESTERDAY)).thenReturn(false);
        when(entryRepository.findByUserIdAndEntryDate(4L, YESTERDAY)).thenReturn(Optional.of(entry(4L, YESTERDAY, 11)));

        NextReviewDTO result = entryService.getNextReview(1L);

        assertEquals("entry of 4", result.getComment());
        verify(assignmentRepository, times(1)).findRandomUnassignedAuthor(1L, YESTERDAY);
    }

    @Test
    void testGetNextReview_RetryExhausted() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY)).thenReturn(Optional.empty());
        when(assignmentRepository.findRandomUnassignedAuthor(1L, YESTERDAY)).thenReturn(Optional.of(2L));
        when(assignmentRepository.tryCreate(1L, 2L, YESTERDAY)).thenReturn(false);

        assertThrows(AssignmentConflictException.class, () -> entryService.getNextReview(1L));
        verify(assignmentRepository, times(EntryServiceImpl.MAX_ASSIGNMENT_ATTEMPTS)).tryCreate(1L, 2L, YESTERDAY);
    }

    @Test
    void testGetNextReview_UnknownUser() {
        when(userRepository.existsById(42L)).thenReturn(false);

        assertThrows(NotFoundException.class, () -> entryService.getNextReview(42L));
    }

    // ---------------- saveRating ----------------

    @Test
    void testSaveRating_OnlyYesterdayAllowed() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> entryService.saveRating(1L, ratingRequest(2L, "2024-01-13", 10)));

        assertTrue(ex.getMessage().contains("yesterday"));
        verifyNoInteractions(ratingRepository);
    }

    @Test
    void testSaveRating_MalformedDate() {
        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(2L, "14/01/2024", 10)));
    }

    @Test
    void testSaveRating_RatingOutOfRange() {
        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(2L, "2024-01-14", 21)));
        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(2L, "2024-01-14", -1)));
        verifyNoInteractions(ratingRepository);
    }

    @Test
    void testSaveRating_AlreadyRated() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(true);

        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(2L, "2024-01-14", 10)));
        verify(ratingRepository, never()).saveAndFlush(any());
    }

    @Test
    void testSaveRating_NoAssignment() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(ratingRepository.existsByFromUserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(assignmentRepository.findByReviewerIdAndEntryDate(1L, YESTERDAY)).thenReturn(Optional.empty());

        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(2L, "2024-01-14", 10)));
    }

    @Test
    void testSaveRating_TargetMismatch() {
        stubValidRatingPreconditions();

        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(3L, "2024-01-14", 10)));
        verify(ratingRepository, never()).saveAndFlush(any());
    }

    @Test
    void testSaveRating_GuessedUserMustExist() {
        stubValidRatingPreconditions();
        when(userRepository.existsById(99L)).thenReturn(false);
        RatingRequest request = ratingRequest(2L, "2024-01-14", 10);
        request.setGuessedUserId(99L);

        assertThrows(NotFoundException.class, () -> entryService.saveRating(1L, request));
        verify(ratingRepository, never()).saveAndFlush(any());
    }

    @Test
    void testSaveRating_GuessedRatingOutOfRange() {
        stubValidRatingPreconditions();
        RatingRequest request = ratingRequest(2L, "2024-01-14", 10);
        request.setGuessedRating(25);

        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, request));
        verify(ratingRepository, never()).saveAndFlush(any());
    }

    @Test
    void testSaveRating_WithoutGuess() {
        stubValidRatingPreconditions();
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class))).thenAnswer(inv -> inv.getArgument(0));
        when(badgeService.evaluateBadges(1L)).thenReturn(Collections.emptyList());
        when(badgeService.evaluateBadges(2L)).thenReturn(Collections.emptyList());

        SaveRatingResultDTO result = entryService.saveRating(1L, ratingRequest(2L, "2024-01-14", 15));

        assertNull(result.getGuessResult());
        assertTrue(result.getNewBadges().isEmpty());
        ArgumentCaptor<PeerRating> captor = ArgumentCaptor.forClass(PeerRating.class);
        verify(ratingRepository).saveAndFlush(captor.capture());
        assertEquals(1L, captor.getValue().getFromUserId());
        assertEquals(2L, captor.getValue().getToUserId());
        assertEquals(15, captor.getValue().getRating());
        verifyNoInteractions(guessRepository);
    }

    // 不带 toUserId：被评人取自分配
    @Test
    void testSaveRating_RevieweeResolvedFromAssignment() {
        stubValidRatingPreconditions();
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class))).thenAnswer(inv -> inv.getArgument(0));
        when(badgeService.evaluateBadges(1L)).thenReturn(Collections.emptyList());
        when(badgeService.evaluateBadges(2L)).thenReturn(Collections.emptyList());

        entryService.saveRating(1L, ratingRequest(null, "2024-01-14", 8));

        ArgumentCaptor<PeerRating> captor = ArgumentCaptor.forClass(PeerRating.class);
        verify(ratingRepository).saveAndFlush(captor.capture());
        assertEquals(2L, captor.getValue().getToUserId());
        assertEquals(8, captor.getValue().getRating());
    }

    // 作者猜中，分数差 1 在容忍范围内但不精确
    @Test
    void testSaveRating_GuessScoredAndRevealed() {
        stubValidRatingPreconditions();
        when(userRepository.existsById(2L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class))).thenAnswer(inv -> inv.getArgument(0));
        when(guessRepository.existsByGuesserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(guessRepository.saveAndFlush(any(AuthorGuess.class))).thenAnswer(inv -> inv.getArgument(0));
        when(guessRepository.findAuthorOutcomes(1L)).thenReturn(Map.of(YESTERDAY, true, YESTERDAY.minusDays(1), true));
        when(userRepository.findById(2L)).thenReturn(Optional.of(new AppUser(2L, "bob", LocalDateTime.now())));
        when(badgeService.evaluateBadges(1L)).thenReturn(List.of("detective_10"));
        when(badgeService.evaluateBadges(2L)).thenReturn(Collections.emptyList());

        RatingRequest request = ratingRequest(2L, "2024-01-14", 15);
        request.setGuessedUserId(2L);
        request.setGuessedRating(13);
        SaveRatingResultDTO result = entryService.saveRating(1L, request);

        assertEquals(List.of("detective_10"), result.getNewBadges());
        assertTrue(result.getGuessResult().getAuthorCorrect());
        assertTrue(result.getGuessResult().getRatingCorrect());
        assertFalse(result.getGuessResult().getRatingExact());
        assertEquals(12, result.getGuessResult().getActualRating());
        assertEquals("bob", result.getGuessResult().getActualAuthorName());
        assertEquals(2, result.getGuessResult().getDetectiveStreak());
        assertTrue(result.getGuessResult().isRecorded());
    }

    @Test
    void testSaveRating_WrongAuthorAndRatingOffByTwo() {
        stubValidRatingPreconditions();
        when(userRepository.existsById(3L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class))).thenAnswer(inv -> inv.getArgument(0));
        when(guessRepository.existsByGuesserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(guessRepository.saveAndFlush(any(AuthorGuess.class))).thenAnswer(inv -> inv.getArgument(0));
        when(userRepository.findById(2L)).thenReturn(Optional.of(new AppUser(2L, "bob", LocalDateTime.now())));

        RatingRequest request = ratingRequest(2L, "2024-01-14", 15);
        request.setGuessedUserId(3L);
        request.setGuessedRating(14);
        SaveRatingResultDTO result = entryService.saveRating(1L, request);

        assertFalse(result.getGuessResult().getAuthorCorrect());
        assertFalse(result.getGuessResult().getRatingCorrect());
        assertFalse(result.getGuessResult().getRatingExact());
        assertEquals(0, result.getGuessResult().getDetectiveStreak());
    }

    // 只猜分数：作者字段为空
    @Test
    void testSaveRating_RatingOnlyGuessExact() {
        stubValidRatingPreconditions();
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class))).thenAnswer(inv -> inv.getArgument(0));
        when(guessRepository.existsByGuesserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(guessRepository.saveAndFlush(any(AuthorGuess.class))).thenAnswer(inv -> inv.getArgument(0));
        when(userRepository.findById(2L)).thenReturn(Optional.of(new AppUser(2L, "bob", LocalDateTime.now())));

        RatingRequest request = ratingRequest(2L, "2024-01-14", 15);
        request.setGuessedRating(12);
        SaveRatingResultDTO result = entryService.saveRating(1L, request);

        assertNull(result.getGuessResult().getAuthorCorrect());
        assertTrue(result.getGuessResult().getRatingCorrect());
        assertTrue(result.getGuessResult().getRatingExact());
    }

    // 猜测写入失败不影响已提交的评分
    @Test
    void testSaveRating_GuessFailureKeepsRating() {
        stubValidRatingPreconditions();
        when(userRepository.existsById(2L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class))).thenAnswer(inv -> inv.getArgument(0));
        when(guessRepository.existsByGuesserIdAndEntryDate(1L, YESTERDAY)).thenReturn(false);
        when(guessRepository.saveAndFlush(any(AuthorGuess.class)))
                .thenThrow(new DataIntegrityViolationException("uk_guess_guesser_date"));
        when(userRepository.findById(2L)).thenReturn(Optional.of(new AppUser(2L, "bob", LocalDateTime.now())));

        RatingRequest request = ratingRequest(2L, "2024-01-14", 15);
        request.setGuessedUserId(2L);
        SaveRatingResultDTO result = entryService.saveRating(1L, request);

        assertFalse(result.getGuessResult().isRecorded());
        assertTrue(result.getGuessResult().getAuthorCorrect());
        verify(ratingRepository).saveAndFlush(any(PeerRating.class));
        verify(badgeService).evaluateBadges(1L);
    }

    @Test
    void testSaveRating_DuplicateKeyRace() {
        stubValidRatingPreconditions();
        when(entryRepository.findByUserIdAndEntryDate(2L, YESTERDAY)).thenReturn(Optional.of(entry(2L, YESTERDAY, 12)));
        when(ratingRepository.saveAndFlush(any(PeerRating.class)))
                .thenThrow(new DataIntegrityViolationException("uk_rating_from_date"));

        assertThrows(ValidationException.class, () -> entryService.saveRating(1L, ratingRequest(2L, "2024-01-14", 15)));
        verifyNoInteractions(badgeService);
    }

    // ---------------- saveEntry ----------------

    @Test
    void testSaveEntry_Creates() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(1L, TODAY)).thenReturn(Optional.empty());
        when(entryRepository.saveAndFlush(any(JournalEntry.class))).thenAnswer(inv -> inv.getArgument(0));
        when(badgeService.evaluateBadges(1L)).thenReturn(List.of("perfect_20"));

        EntryRequest request = new EntryRequest();
        request.setRating(20);
        request.setComment("great");
        request.setTags(Arrays.asList("sport", "sport", "good_sleep"));
        SaveEntryResultDTO result = entryService.saveEntry(1L, request);

        assertFalse(result.isUpdate());
        assertEquals(List.of("perfect_20"), result.getNewBadges());
        ArgumentCaptor<JournalEntry> captor = ArgumentCaptor.forClass(JournalEntry.class);
        verify(entryRepository).saveAndFlush(captor.capture());
        assertEquals(TODAY, captor.getValue().getEntryDate());
        assertEquals(List.of(EntryTag.SPORT, EntryTag.GOOD_SLEEP), captor.getValue().getTags());
    }

    @Test
    void testSaveEntry_UpdatesExisting() {
        JournalEntry existing = entry(1L, TODAY, 8);
        when(userRepository.existsById(1L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(1L, TODAY)).thenReturn(Optional.of(existing));
        when(badgeService.evaluateBadges(1L)).thenReturn(Collections.emptyList());

        EntryRequest request = new EntryRequest();
        request.setRating(11);
        SaveEntryResultDTO result = entryService.saveEntry(1L, request);

        assertTrue(result.isUpdate());
        assertEquals(11, existing.getRating());
        assertNull(existing.getComment());
        verify(entryRepository).save(existing);
        verify(entryRepository, never()).saveAndFlush(any());
    }

    // 并发插入失败：读出对方的记录并覆盖
    @Test
    void testSaveEntry_ConcurrentInsertBecomesUpdate() {
        JournalEntry winner = entry(1L, TODAY, 5);
        when(userRepository.existsById(1L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(1L, TODAY)).thenReturn(Optional.empty(), Optional.of(winner));
        when(entryRepository.saveAndFlush(any(JournalEntry.class)))
                .thenThrow(new DataIntegrityViolationException("uk_entry_user_date"));

        EntryRequest request = new EntryRequest();
        request.setRating(16);
        SaveEntryResultDTO result = entryService.saveEntry(1L, request);

        assertTrue(result.isUpdate());
        assertEquals(16, winner.getRating());
        verify(entryRepository).save(winner);
    }

    @Test
    void testSaveEntry_InvalidInputTouchesNothing() {
        EntryRequest request = new EntryRequest();
        request.setRating(12);
        request.setTags(List.of("not_a_tag"));

        assertThrows(ValidationException.class, () -> entryService.saveEntry(1L, request));
        verifyNoInteractions(entryRepository, badgeService);
    }

    @Test
    void testGetTodayEntry_Absent() {
        when(userRepository.existsById(1L)).thenReturn(true);
        when(entryRepository.findByUserIdAndEntryDate(1L, TODAY)).thenReturn(Optional.empty());

        assertFalse(entryService.getTodayEntry(1L).isExists());
    }
}
