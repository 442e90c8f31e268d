package com.good4it.lendingservice;

import com.good4it.lendingservice.client.SocialGraphGateway;
import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;
import com.good4it.lendingservice.core.exception.NotFriendsException;
import com.good4it.lendingservice.dto.FriendBalanceResponse;
import com.good4it.lendingservice.dto.LendingSummaryResponse;
import com.good4it.lendingservice.dto.ScoreAnalyticsResponse;
import com.good4it.lendingservice.dto.client.ScoreHistoryEntry;
import com.good4it.lendingservice.dto.client.ScoreSnapshot;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.RequestStatus;
import com.good4it.lendingservice.model.TransactionStatus;
import com.good4it.lendingservice.repository.MoneyRequestRepository;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.service.implementation.LendingInsightServiceImp;
import com.good4it.lendingservice.service.reputation.ReputationLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LendingInsightServiceUnitTest {

    private static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    @Mock
    private MoneyTransactionRepository transactionRepository;
    @Mock
    private MoneyRequestRepository requestRepository;
    @Mock
    private SocialGraphGateway socialGraph;
    @Mock
    private ReputationLedger reputationLedger;

    private LendingInsightServiceImp service;

    private UUID userId;
    private UUID friendId;

    @BeforeEach
    void setUp() {
        service = new LendingInsightServiceImp(transactionRepository, requestRepository, socialGraph, reputationLedger,
                Clock.fixed(NOW, ZoneOffset.UTC));
        userId = UUID.randomUUID();
        friendId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Summary adds up disbursed loans, repayments, forgiveness and pending requests")
    void testSummary() {
        when(transactionRepository.totalsAsLender(userId)).thenReturn(List.of(
                txTotal(TransactionStatus.MONEY_SENT, 1, "500", "0", null),
                txTotal(TransactionStatus.MONEY_RECEIVED, 2, "300", "50", null),
                txTotal(TransactionStatus.FORGIVEN, 1, "200", "80", "120")));
        when(transactionRepository.totalsAsBorrower(userId)).thenReturn(List.of(
                txTotal(TransactionStatus.REPAID, 2, "150", "150", null),
                txTotal(TransactionStatus.REPAYMENT_REJECTED, 1, "70", "70", null)));
        when(requestRepository.totalsAsRequestor(userId)).thenReturn(List.of(
                requestTotal(RequestStatus.APPROVED, 3, "220"),
                requestTotal(RequestStatus.PENDING, 1, "30"),
                requestTotal(RequestStatus.REJECTED, 2, "90")));
        when(requestRepository.totalsAsLender(userId)).thenReturn(List.of(
                requestTotal(RequestStatus.APPROVED, 4, "1000"),
                requestTotal(RequestStatus.PENDING, 2, "45.5")));

        MoneyTransaction owedToUser = MoneyTransaction.builder().id(UUID.randomUUID()).lenderId(userId)
                .requestorId(friendId).amount(new BigDecimal("100")).repaymentAmount(new BigDecimal("25"))
                .status(TransactionStatus.MONEY_RECEIVED).build();
        when(transactionRepository.findByLenderIdAndStatusInOrderByCreatedAtAsc(eq(userId), anyCollection()))
                .thenReturn(List.of(owedToUser));
        when(transactionRepository.findByRequestorIdAndStatusInOrderByCreatedAtAsc(eq(userId), anyCollection()))
                .thenReturn(List.of());

        LendingSummaryResponse summary = service.summary(userId);

        assertThat(summary.totalLent()).isEqualByComparingTo("500");
        assertThat(summary.totalReceived()).isEqualByComparingTo("150");
        assertThat(summary.totalReturned()).isEqualByComparingTo("150");
        assertThat(summary.totalRequested()).isEqualByComparingTo("220");
        assertThat(summary.totalPending()).isEqualByComparingTo("75.5");
        assertThat(summary.totalForgiven()).isEqualByComparingTo("120");
        assertThat(summary.counts()).isEqualTo(new LendingSummaryResponse.Counts(3, 4, 2, 2, 3, 2, 1));
        assertThat(summary.toReturn()).isEmpty();
        assertThat(summary.toReceive()).singleElement().satisfies(open -> {
            assertThat(open.counterpartyId()).isEqualTo(friendId);
            assertThat(open.remaining()).isEqualByComparingTo("75");
        });
    }

    @Test
    @DisplayName("A user with no activity gets an all-zero summary")
    void testSummary_Empty() {
        LendingSummaryResponse summary = service.summary(userId);

        assertThat(summary.totalLent()).isEqualByComparingTo("0");
        assertThat(summary.totalForgiven()).isEqualByComparingTo("0");
        assertThat(summary.counts()).isEqualTo(new LendingSummaryResponse.Counts(0, 0, 0, 0, 0, 0, 0));
    }

    @Test
    @DisplayName("Friend balance nets what the friend owes against what the user owes")
    void testFriendBalance() {
        when(socialGraph.areFriends(userId, friendId)).thenReturn(true);
        when(transactionRepository.totalsBetween(userId, friendId)).thenReturn(List.of(
                txTotal(TransactionStatus.MONEY_RECEIVED, 1, "300", "100", null),
                txTotal(TransactionStatus.REPAID, 1, "50", "50", null)));
        when(transactionRepository.totalsBetween(friendId, userId)).thenReturn(List.of(
                txTotal(TransactionStatus.MONEY_SENT, 1, "80", "0", null),
                txTotal(TransactionStatus.FORGIVEN, 1, "60", "10", "50")));
        when(transactionRepository.findBetween(eq(userId), eq(friendId), any(Pageable.class))).thenReturn(List.of());

        FriendBalanceResponse balance = service.friendBalance(userId, friendId);

        assertThat(balance.lentToFriend()).isEqualByComparingTo("350");
        assertThat(balance.borrowedFromFriend()).isEqualByComparingTo("140");
        assertThat(balance.repaidByFriend()).isEqualByComparingTo("150");
        assertThat(balance.repaidToFriend()).isEqualByComparingTo("10");
        assertThat(balance.friendOwes()).isEqualByComparingTo("200");
        assertThat(balance.youOwe()).isEqualByComparingTo("80");
        assertThat(balance.netBalance()).isEqualByComparingTo("120");
        assertThat(balance.transactionCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Friend balance is only visible between friends")
    void testFriendBalance_NotFriends() {
        when(socialGraph.areFriends(userId, friendId)).thenReturn(false);

        assertThatThrownBy(() -> service.friendBalance(userId, friendId))
                .isInstanceOf(NotFriendsException.class);
        verifyNoInteractions(transactionRepository);
    }

    @Test
    @DisplayName("Score analytics groups the period's history by type and month")
    void testScoreAnalytics() {
        when(reputationLedger.currentScore(userId)).thenReturn(new ScoreSnapshot(userId, 63, 12));
        when(reputationLedger.history(userId, NOW.minus(Duration.ofDays(90)))).thenReturn(List.of(
                entry("EARLY_REPAYMENT", 5, "2024-06-10T09:00:00Z"),
                entry("LATE_REPAYMENT", -4, "2024-05-20T09:00:00Z"),
                entry("EARLY_REPAYMENT", 3, "2024-05-02T09:00:00Z"),
                entry("FRAUDULENT_PROOF", -10, "2024-04-01T09:00:00Z")));

        ScoreAnalyticsResponse analytics = service.scoreAnalytics(userId, "90d");

        assertThat(analytics.currentScore()).isEqualTo(63);
        assertThat(analytics.period()).isEqualTo("90d");
        assertThat(analytics.totalChanges()).isEqualTo(4);
        assertThat(analytics.positiveChanges()).isEqualTo(2);
        assertThat(analytics.negativeChanges()).isEqualTo(2);
        assertThat(analytics.totalScoreChange()).isEqualTo(-6);
        assertThat(analytics.changeTypes().get("EARLY_REPAYMENT"))
                .isEqualTo(new ScoreAnalyticsResponse.ChangeTypeStats(2, 8, 4.0));
        assertThat(analytics.monthlyTrend()).extracting(ScoreAnalyticsResponse.MonthlyTrend::month)
                .containsExactly("2024-04", "2024-05", "2024-06");
        assertThat(analytics.monthlyTrend().get(1).scoreChange()).isEqualTo(-1);
        assertThat(analytics.topPositiveEvents()).extracting(ScoreAnalyticsResponse.ScoreEvent::scoreChange)
                .containsExactly(5, 3);
        assertThat(analytics.topNegativeEvents()).extracting(ScoreAnalyticsResponse.ScoreEvent::scoreChange)
                .containsExactly(-10, -4);
    }

    @Test
    @DisplayName("All-time analytics reads the history without a lower bound")
    void testScoreAnalytics_AllTime() {
        when(reputationLedger.currentScore(userId)).thenReturn(new ScoreSnapshot(userId, 50, 0));
        when(reputationLedger.history(userId, null)).thenReturn(List.of());

        ScoreAnalyticsResponse analytics = service.scoreAnalytics(userId, "all");

        assertThat(analytics.totalChanges()).isZero();
        assertThat(analytics.changeTypes()).isEmpty();
        assertThat(analytics.monthlyTrend()).isEmpty();
    }

    @Test
    @DisplayName("Unknown analytics period is rejected before the score service is called")
    void testScoreAnalytics_UnknownPeriod() {
        assertThatThrownBy(() -> service.scoreAnalytics(userId, "2w"))
                .isInstanceOf(InvalidLendingRequestException.class)
                .extracting("code").isEqualTo(InvalidLendingRequestException.INVALID_PERIOD);
        verifyNoInteractions(reputationLedger);
    }

    private static ScoreHistoryEntry entry(String type, int change, String at) {
        return new ScoreHistoryEntry(UUID.randomUUID(), null, type, change, 50, 50 + change, type,
                Instant.parse(at));
    }

    private static MoneyTransactionRepository.StatusTotal txTotal(TransactionStatus status, long transactions,
                                                                 String amount, String repaid, String forgiven) {
        return new MoneyTransactionRepository.StatusTotal() {
            @Override
            public TransactionStatus getStatus() {
                return status;
            }

            @Override
            public long getTransactions() {
                return transactions;
            }

            @Override
            public BigDecimal getAmount() {
                return new BigDecimal(amount);
            }

            @Override
            public BigDecimal getRepaid() {
                return new BigDecimal(repaid);
            }

            @Override
            public BigDecimal getForgiven() {
                return forgiven == null ? null : new BigDecimal(forgiven);
            }
        };
    }

    private static MoneyRequestRepository.StatusTotal requestTotal(RequestStatus status, long requests, String amount) {
        return new MoneyRequestRepository.StatusTotal() {
            @Override
            public RequestStatus getStatus() {
                return status;
            }

            @Override
            public long getRequests() {
                return requests;
            }

            @Override
            public BigDecimal getAmount() {
                return new BigDecimal(amount);
            }
        };
    }
}
