package com.good4it.lendingservice;

import com.good4it.lendingservice.core.exception.NotEmiTransactionException;
import com.good4it.lendingservice.model.*;
import com.good4it.lendingservice.service.emi.EmiForgivenessReconciler;
import com.good4it.lendingservice.service.emi.ReconciliationResult;
import com.good4it.lendingservice.service.period.PeriodCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmiForgivenessReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final EmiForgivenessReconciler reconciler = new EmiForgivenessReconciler(new PeriodCalculator(ZoneOffset.UTC));

    @Test
    @DisplayName("Forgivable EMIs scale with the loan in hundreds, capped at 24 and at 5 for small loans")
    void testMaxForgivableEmis() {
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("50"))).isEqualTo(1);
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("450"))).isEqualTo(4);
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("500"))).isEqualTo(5);
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("599.99"))).isEqualTo(5);
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("800"))).isEqualTo(8);
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("1200"))).isEqualTo(12);
        assertThat(EmiForgivenessReconciler.maxForgivableEmis(new BigDecimal("3000"))).isEqualTo(24);
    }

    @Test
    @DisplayName("Forgiveness months are consecutive and roll over the year")
    void testForgivenessMonths() {
        assertThat(EmiForgivenessReconciler.forgivenessMonths(YearMonth.of(2024, 11), 3))
                .containsExactly("2024-11", "2024-12", "2025-01");
        assertThat(EmiForgivenessReconciler.endMonth(YearMonth.of(2024, 11), 3)).isEqualTo(YearMonth.of(2025, 1));
    }

    @Test
    @DisplayName("EMI task forgives one installment per month and moves the paid-up marker")
    void testEmiTaskCredit() {
        MoneyTransaction transaction = emiTransaction(new BigDecimal("1200.0000"), BigDecimal.ZERO);
        Task task = emiTask(2, "2024-03");

        ReconciliationResult result = reconciler.applyTaskConfirmation(transaction, task, NOW);

        assertThat(result.credited()).isEqualByComparingTo("200");
        assertThat(result.forgivenMonths()).containsExactly("2024-03", "2024-04");
        assertThat(result.settled()).isFalse();

        assertThat(transaction.getRepaymentAmount()).isEqualByComparingTo("200");
        assertThat(transaction.getTotalForgivenEmis()).isEqualTo(2);
        assertThat(transaction.getEmiForgiveness()).hasSize(2)
                .allMatch(emi -> task.getId().equals(emi.getTaskId()));
        assertThat(transaction.getRepaymentReceivedAt()).isEqualTo(Instant.parse("2024-04-30T23:59:59.999Z"));
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.MONEY_RECEIVED);
        assertThat(task.getAmountRepaid()).isEqualByComparingTo("200");
    }

    @Test
    @DisplayName("Credit that reaches the loan amount settles the transaction")
    void testSettlingCredit() {
        MoneyTransaction transaction = emiTransaction(new BigDecimal("1200.0000"), new BigDecimal("1100.0000"));

        ReconciliationResult result = reconciler.applyTaskConfirmation(transaction, emiTask(1, "2024-12"), NOW);

        assertThat(result.settled()).isTrue();
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.REPAID);
        assertThat(transaction.getRepaymentReceivedAt()).isEqualTo(NOW);
        assertThat(transaction.remainingBalance()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Plain task credits its monetary value")
    void testPlainTaskCredit() {
        MoneyTransaction transaction = MoneyTransaction.builder()
                .id(UUID.randomUUID())
                .amount(new BigDecimal("1000.0000"))
                .status(TransactionStatus.MONEY_RECEIVED)
                .build();
        Task task = Task.builder().id(UUID.randomUUID()).monetaryValue(new BigDecimal("150")).build();

        ReconciliationResult result = reconciler.applyTaskConfirmation(transaction, task, NOW);

        assertThat(result.credited()).isEqualByComparingTo("150");
        assertThat(result.forgivenMonths()).isEmpty();
        assertThat(transaction.remainingBalance()).isEqualByComparingTo("850");
        assertThat(transaction.getEmiForgiveness()).isEmpty();
    }

    @Test
    @DisplayName("EMI task against a non-EMI transaction is rejected")
    void testEmiTaskOnPlainTransaction() {
        MoneyTransaction transaction = MoneyTransaction.builder()
                .id(UUID.randomUUID())
                .amount(new BigDecimal("1000.0000"))
                .status(TransactionStatus.MONEY_RECEIVED)
                .build();

        assertThatThrownBy(() -> reconciler.applyTaskConfirmation(transaction, emiTask(1, "2024-03"), NOW))
                .isInstanceOf(NotEmiTransactionException.class);
        assertThat(transaction.getRepaymentAmount()).isEqualByComparingTo("0");
    }

    private static MoneyTransaction emiTransaction(BigDecimal amount, BigDecimal repaid) {
        return MoneyTransaction.builder()
                .id(UUID.randomUUID())
                .amount(amount)
                .repaymentAmount(repaid)
                .status(TransactionStatus.MONEY_RECEIVED)
                .paymentType(PaymentType.EMI)
                .emiDetails(EmiDetails.builder()
                        .numberOfInstallments(12)
                        .installmentAmount(new BigDecimal("100.0000"))
                        .frequency(EmiFrequency.MONTHLY)
                        .build())
                .build();
    }

    private static Task emiTask(int forgivenEmis, String startMonth) {
        YearMonth start = YearMonth.parse(startMonth);
        return Task.builder()
                .id(UUID.randomUUID())
                .emiTask(true)
                .emiForgiveness(EmiForgivenessWindow.builder()
                        .forgivenEmis(forgivenEmis)
                        .startMonth(startMonth)
                        .endMonth(EmiForgivenessReconciler.endMonth(start, forgivenEmis).toString())
                        .build())
                .build();
    }
}
