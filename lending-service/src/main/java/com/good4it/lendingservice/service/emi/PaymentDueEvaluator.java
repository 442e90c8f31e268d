package com.good4it.lendingservice.service.emi;

import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.Task;
import com.good4it.lendingservice.model.TaskStatus;
import com.good4it.lendingservice.repository.TaskRepository;
import com.good4it.lendingservice.service.period.Period;
import com.good4it.lendingservice.service.period.PeriodCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;

// First match wins: forgiveness window, repayment in period, settled
@Component
@RequiredArgsConstructor
public class PaymentDueEvaluator {

    private final TaskRepository taskRepository;
    private final PeriodCalculator periodCalculator;

    public PaymentDue evaluate(MoneyTransaction transaction, Instant at) {
        if (!transaction.isEmi()) {
            PaymentDueStatus status = transaction.getStatus().isSettled()
                    ? PaymentDueStatus.ALREADY_SETTLED
                    : PaymentDueStatus.NOT_EMI;
            return new PaymentDue(transaction.getId(), status, status.paymentRequired(),
                    null, null, null, null, null);
        }

        Period period = periodCalculator.periodContaining(transaction.getEmiDetails().getFrequency(), at);
        PaymentDueStatus status = statusFor(transaction, period);

        return new PaymentDue(
                transaction.getId(),
                status,
                status.paymentRequired(),
                period.key(),
                period.start(),
                period.endExclusive(),
                periodCalculator.nextPeriodStart(period.frequency(), period.key()),
                transaction.getEmiDetails().getInstallmentAmount()
        );
    }

    private PaymentDueStatus statusFor(MoneyTransaction transaction, Period period) {
        if (forgivenByTask(transaction, period)) {
            return PaymentDueStatus.FORGIVEN_BY_TASK;
        }

        Instant paidAt = transaction.getRepaymentReceivedAt();
        if (paidAt != null && period.contains(paidAt)) {
            return PaymentDueStatus.ALREADY_PAID_THIS_PERIOD;
        }

        if (transaction.getStatus().isSettled()) {
            return PaymentDueStatus.ALREADY_SETTLED;
        }

        return PaymentDueStatus.DUE;
    }

    // A period belongs to a window when the month it starts in was forgiven
    private boolean forgivenByTask(MoneyTransaction transaction, Period period) {
        YearMonth periodMonth = YearMonth.from(LocalDate.ofInstant(period.start(), periodCalculator.zone()));

        List<Task> confirmed = taskRepository.findByReferenceTransactionIdAndStatusAndEmiTaskTrue(
                transaction.getId(), TaskStatus.CONFIRMED);

        return confirmed.stream()
                .map(Task::getEmiForgiveness)
                .filter(Objects::nonNull)
                .anyMatch(window -> window.covers(periodMonth));
    }
}
