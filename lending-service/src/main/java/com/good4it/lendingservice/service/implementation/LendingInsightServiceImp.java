package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.client.SocialGraphGateway;
import com.good4it.lendingservice.core.exception.NotFriendsException;
import com.good4it.lendingservice.dto.AnalyticsPeriod;
import com.good4it.lendingservice.dto.FriendBalanceResponse;
import com.good4it.lendingservice.dto.LendingSummaryResponse;
import com.good4it.lendingservice.dto.ScoreAnalyticsResponse;
import com.good4it.lendingservice.dto.TransactionResponse;
import com.good4it.lendingservice.dto.client.ScoreHistoryEntry;
import com.good4it.lendingservice.dto.client.ScoreSnapshot;
import com.good4it.lendingservice.model.RequestStatus;
import com.good4it.lendingservice.model.TransactionStatus;
import com.good4it.lendingservice.repository.MoneyRequestRepository;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.service.LendingInsightService;
import com.good4it.lendingservice.service.reputation.ReputationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class LendingInsightServiceImp implements LendingInsightService {

    // Money has reached the borrower
    private static final Set<TransactionStatus> DISBURSED = EnumSet.of(TransactionStatus.MONEY_RECEIVED,
            TransactionStatus.REPAYMENT_SENT, TransactionStatus.REPAID, TransactionStatus.FORGIVEN);

    private static final Set<TransactionStatus> AWAITING_REPAYMENT =
            EnumSet.of(TransactionStatus.MONEY_RECEIVED, TransactionStatus.REPAYMENT_SENT);

    private static final Set<TransactionStatus> OUTSTANDING = EnumSet.of(TransactionStatus.MONEY_SENT,
            TransactionStatus.MONEY_RECEIVED, TransactionStatus.REPAYMENT_SENT);

    private static final int RECENT_WITH_FRIEND = 10;
    private static final int TOP_EVENTS = 5;
    private static final int TREND_MONTHS = 12;

    private final MoneyTransactionRepository transactionRepository;
    private final MoneyRequestRepository requestRepository;
    private final SocialGraphGateway socialGraph;
    private final ReputationLedger reputationLedger;
    private final Clock clock;

    @Override
    public LendingSummaryResponse summary(UUID userId) {
        Map<TransactionStatus, MoneyTransactionRepository.StatusTotal> lent =
                byTransactionStatus(transactionRepository.totalsAsLender(userId));
        Map<TransactionStatus, MoneyTransactionRepository.StatusTotal> borrowed =
                byTransactionStatus(transactionRepository.totalsAsBorrower(userId));
        Map<RequestStatus, MoneyRequestRepository.StatusTotal> sent =
                byRequestStatus(requestRepository.totalsAsRequestor(userId));
        Map<RequestStatus, MoneyRequestRepository.StatusTotal> received =
                byRequestStatus(requestRepository.totalsAsLender(userId));

        BigDecimal totalLent = BigDecimal.ZERO;
        BigDecimal totalReceived = BigDecimal.ZERO;
        long receivedCount = 0;
        for (TransactionStatus status : DISBURSED) {
            totalLent = totalLent.add(amount(lent.get(status)));
            totalReceived = totalReceived.add(amount(borrowed.get(status)));
            receivedCount += count(borrowed.get(status));
        }

        var counts = new LendingSummaryResponse.Counts(
                count(sent.get(RequestStatus.APPROVED)),
                count(received.get(RequestStatus.APPROVED)),
                receivedCount,
                count(borrowed.get(TransactionStatus.REPAID)),
                count(sent.get(RequestStatus.PENDING)) + count(received.get(RequestStatus.PENDING)),
                count(sent.get(RequestStatus.REJECTED)) + count(received.get(RequestStatus.REJECTED)),
                count(lent.get(TransactionStatus.FORGIVEN)));

        LendingSummaryResponse summary = new LendingSummaryResponse(
                amount(sent.get(RequestStatus.APPROVED)),
                totalLent,
                totalReceived,
                repaid(borrowed.get(TransactionStatus.REPAID)),
                amount(sent.get(RequestStatus.PENDING)).add(amount(received.get(RequestStatus.PENDING))),
                forgiven(lent.get(TransactionStatus.FORGIVEN)),
                counts,
                transactionRepository.findByRequestorIdAndStatusInOrderByCreatedAtAsc(userId, AWAITING_REPAYMENT)
                        .stream().map(LendingSummaryResponse.OpenBalance::owedTo).toList(),
                transactionRepository.findByLenderIdAndStatusInOrderByCreatedAtAsc(userId, AWAITING_REPAYMENT)
                        .stream().map(LendingSummaryResponse.OpenBalance::owedBy).toList());

        log.debug("Summary for {}: lent {}, received {}", userId, totalLent, totalReceived);
        return summary;
    }

    @Override
    public FriendBalanceResponse friendBalance(UUID userId, UUID friendId) {
        if (!socialGraph.areFriends(userId, friendId)) {
            throw new NotFriendsException(userId, friendId);
        }

        List<MoneyTransactionRepository.StatusTotal> lent = transactionRepository.totalsBetween(userId, friendId);
        List<MoneyTransactionRepository.StatusTotal> borrowed = transactionRepository.totalsBetween(friendId, userId);

        BigDecimal friendOwes = outstanding(lent);
        BigDecimal youOwe = outstanding(borrowed);

        List<TransactionResponse> recent = transactionRepository
                .findBetween(userId, friendId, PageRequest.of(0, RECENT_WITH_FRIEND)).stream()
                .map(TransactionResponse::from)
                .toList();

        return new FriendBalanceResponse(
                friendId,
                sumAmount(lent),
                sumAmount(borrowed),
                sumRepaid(lent),
                sumRepaid(borrowed),
                friendOwes,
                youOwe,
                friendOwes.subtract(youOwe),
                countAll(lent) + countAll(borrowed),
                recent);
    }

    @Override
    public ScoreAnalyticsResponse scoreAnalytics(UUID userId, String periodKey) {
        AnalyticsPeriod period = AnalyticsPeriod.fromKey(periodKey);

        ScoreSnapshot snapshot = reputationLedger.currentScore(userId);
        List<ScoreHistoryEntry> history = reputationLedger.history(userId, period.since(clock));

        int positive = 0;
        int negative = 0;
        long total = 0;
        Map<String, long[]> perType = new TreeMap<>();
        Map<YearMonth, long[]> perMonth = new TreeMap<>();
        for (ScoreHistoryEntry entry : history) {
            if (entry.scoreChange() > 0) positive++;
            if (entry.scoreChange() < 0) negative++;
            total += entry.scoreChange();

            long[] type = perType.computeIfAbsent(entry.changeType(), k -> new long[2]);
            type[0]++;
            type[1] += entry.scoreChange();

            if (entry.createdAt() != null) {
                long[] month = perMonth.computeIfAbsent(YearMonth.from(entry.createdAt().atZone(ZoneOffset.UTC)),
                        k -> new long[2]);
                month[0]++;
                month[1] += entry.scoreChange();
            }
        }

        Map<String, ScoreAnalyticsResponse.ChangeTypeStats> changeTypes = new TreeMap<>();
        perType.forEach((type, stats) -> changeTypes.put(type,
                new ScoreAnalyticsResponse.ChangeTypeStats((int) stats[0], stats[1], (double) stats[1] / stats[0])));

        List<ScoreAnalyticsResponse.MonthlyTrend> trend = new ArrayList<>();
        perMonth.forEach((month, stats) ->
                trend.add(new ScoreAnalyticsResponse.MonthlyTrend(month.toString(), stats[1], (int) stats[0])));
        List<ScoreAnalyticsResponse.MonthlyTrend> lastMonths =
                trend.subList(Math.max(0, trend.size() - TREND_MONTHS), trend.size());

        return new ScoreAnalyticsResponse(
                snapshot == null ? 0 : snapshot.score(),
                period.key(),
                history.size(),
                positive,
                negative,
                total,
                changeTypes,
                List.copyOf(lastMonths),
                topEvents(history, Comparator.comparingInt(ScoreHistoryEntry::scoreChange).reversed(), true),
                topEvents(history, Comparator.comparingInt(ScoreHistoryEntry::scoreChange), false));
    }

    private static List<ScoreAnalyticsResponse.ScoreEvent> topEvents(List<ScoreHistoryEntry> history,
                                                                      Comparator<ScoreHistoryEntry> order,
                                                                      boolean gains) {
        return history.stream()
                .filter(e -> gains ? e.scoreChange() > 0 : e.scoreChange() < 0)
                .sorted(order)
                .limit(TOP_EVENTS)
                .map(e -> new ScoreAnalyticsResponse.ScoreEvent(e.changeType(), e.scoreChange(), e.description(),
                        e.transactionId(), e.createdAt()))
                .toList();
    }

    private static Map<TransactionStatus, MoneyTransactionRepository.StatusTotal> byTransactionStatus(
            List<MoneyTransactionRepository.StatusTotal> rows) {
        Map<TransactionStatus, MoneyTransactionRepository.StatusTotal> map = new EnumMap<>(TransactionStatus.class);
        rows.forEach(row -> map.put(row.getStatus(), row));
        return map;
    }

    private static Map<RequestStatus, MoneyRequestRepository.StatusTotal> byRequestStatus(
            List<MoneyRequestRepository.StatusTotal> rows) {
        Map<RequestStatus, MoneyRequestRepository.StatusTotal> map = new EnumMap<>(RequestStatus.class);
        rows.forEach(row -> map.put(row.getStatus(), row));
        return map;
    }

    private static BigDecimal outstanding(List<MoneyTransactionRepository.StatusTotal> rows) {
        BigDecimal owed = BigDecimal.ZERO;
        for (MoneyTransactionRepository.StatusTotal row : rows) {
            if (OUTSTANDING.contains(row.getStatus())) {
                owed = owed.add(amount(row).subtract(repaid(row)).max(BigDecimal.ZERO));
            }
        }
        return owed;
    }

    private static BigDecimal sumAmount(List<MoneyTransactionRepository.StatusTotal> rows) {
        return rows.stream().map(LendingInsightServiceImp::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sumRepaid(List<MoneyTransactionRepository.StatusTotal> rows) {
        return rows.stream().map(LendingInsightServiceImp::repaid).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static long countAll(List<MoneyTransactionRepository.StatusTotal> rows) {
        return rows.stream().mapToLong(MoneyTransactionRepository.StatusTotal::getTransactions).sum();
    }

    private static BigDecimal amount(MoneyTransactionRepository.StatusTotal row) {
        return row == null || row.getAmount() == null ? BigDecimal.ZERO : row.getAmount();
    }

    private static BigDecimal repaid(MoneyTransactionRepository.StatusTotal row) {
        return row == null || row.getRepaid() == null ? BigDecimal.ZERO : row.getRepaid();
    }

    private static BigDecimal forgiven(MoneyTransactionRepository.StatusTotal row) {
        return row == null || row.getForgiven() == null ? BigDecimal.ZERO : row.getForgiven();
    }

    private static long count(MoneyTransactionRepository.StatusTotal row) {
        return row == null ? 0 : row.getTransactions();
    }

    private static BigDecimal amount(MoneyRequestRepository.StatusTotal row) {
        return row == null || row.getAmount() == null ? BigDecimal.ZERO : row.getAmount();
    }

    private static long count(MoneyRequestRepository.StatusTotal row) {
        return row == null ? 0 : row.getRequests();
    }
}
