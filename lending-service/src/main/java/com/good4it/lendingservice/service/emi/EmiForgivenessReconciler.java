package com.good4it.lendingservice.service.emi;

import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;
import com.good4it.lendingservice.core.exception.NotEmiTransactionException;
import com.good4it.lendingservice.core.util.MoneyUtil;
import com.good4it.lendingservice.model.EmiForgivenessWindow;
import com.good4it.lendingservice.model.ForgivenEmi;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.Task;
import com.good4it.lendingservice.model.TransactionStatus;
import com.good4it.lendingservice.service.period.Period;
import com.good4it.lendingservice.service.period.PeriodCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Credits a confirmed task against the transaction it references.
 * <p>
 * EMI tasks forgive whole installments month by month and move the "paid up to" marker
 * ({@code repaymentReceivedAt}) to the end of the last forgiven period. Plain tasks credit their monetary value.
 * Either way the transaction becomes {@code REPAID} once the credited total reaches the loan amount.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmiForgivenessReconciler {

    public static final int MAX_FORGIVABLE_EMIS = 24;
    public static final int SMALL_LOAN_MAX_FORGIVABLE_EMIS = 5;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal SMALL_LOAN_LIMIT = BigDecimal.valueOf(500);

    private final PeriodCalculator periodCalculator;

    public static int maxForgivableEmis(BigDecimal loanAmount) {
        long hundreds = loanAmount.divideToIntegralValue(HUNDRED).longValue();
        int max = (int) Math.max(Math.min(hundreds, MAX_FORGIVABLE_EMIS), 1);
        if (loanAmount.compareTo(SMALL_LOAN_LIMIT) <= 0) {
            max = Math.min(max, SMALL_LOAN_MAX_FORGIVABLE_EMIS);
        }
        return max;
    }

    public static List<String> forgivenessMonths(YearMonth startMonth, int forgivenEmis) {
        List<String> months = new ArrayList<>(forgivenEmis);
        for (int i = 0; i < forgivenEmis; i++) {
            months.add(startMonth.plusMonths(i).toString());
        }
        return months;
    }

    public static YearMonth endMonth(YearMonth startMonth, int forgivenEmis) {
        return startMonth.plusMonths(forgivenEmis - 1L);
    }

    public ReconciliationResult applyTaskConfirmation(MoneyTransaction transaction, Task task, Instant now) {
        BigDecimal credit;
        List<String> months = List.of();

        if (task.isEmiTask()) {
            if (!transaction.isEmi()) {
                throw new NotEmiTransactionException(transaction.getId());
            }
            EmiForgivenessWindow window = task.getEmiForgiveness();
            if (window == null || window.getForgivenEmis() == null || window.getStartMonth() == null) {
                throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_TASK,
                        "EMI task " + task.getId() + " has no forgiveness window");
            }

            int forgivenEmis = window.getForgivenEmis();
            BigDecimal installment = transaction.getEmiDetails().getInstallmentAmount();
            months = forgivenessMonths(YearMonth.parse(window.getStartMonth()), forgivenEmis);

            for (String month : months) {
                transaction.getEmiForgiveness().add(ForgivenEmi.builder()
                        .month(month)
                        .amount(installment)
                        .forgivenAt(now)
                        .taskId(task.getId())
                        .build());
            }
            transaction.setTotalForgivenEmis(transaction.getTotalForgivenEmis() + forgivenEmis);

            Period lastForgiven = periodCalculator.periodOfMonth(
                    transaction.getEmiDetails().getFrequency(),
                    YearMonth.parse(months.get(months.size() - 1)));
            transaction.setRepaymentReceivedAt(lastForgiven.lastInstant());

            credit = MoneyUtil.format(installment.multiply(BigDecimal.valueOf(forgivenEmis)));
        } else {
            credit = MoneyUtil.format(task.getMonetaryValue());
        }

        transaction.setRepaymentAmount(MoneyUtil.format(transaction.getRepaymentAmount().add(credit)));
        task.setAmountRepaid(credit);

        boolean settled = transaction.getRepaymentAmount().compareTo(transaction.getAmount()) >= 0;
        if (settled) {
            transaction.setStatus(TransactionStatus.REPAID);
            transaction.setRepaymentReceivedAt(now);
        }

        log.info("Task {} credited {} to transaction {} (forgiven months: {}, settled: {})",
                task.getId(), credit, transaction.getId(), months, settled);

        return new ReconciliationResult(credit, months, settled);
    }
}
