package com.good4it.lendingservice.service.notification;

// {name} acting user, {amount} formatted amount, {detail} optional suffix
public enum NotificationEvent {

    MONEY_REQUEST("New Money Request",
            "{name} wants to borrow {amount} from you"),
    MONEY_REQUEST_REJECTED("Request Declined",
            "{name} declined your money request for {amount}. You can try asking someone else."),
    MONEY_SENT("Payment Claimed",
            "{name} has claimed to send you {amount}. Confirm when received."),
    MONEY_RECEIPT_CONFIRMED("Receipt Confirmed",
            "{name} confirmed receiving {amount}. Transaction completed successfully."),
    REPAYMENT_RECEIVED("Repayment Received",
            "{name} sent a repayment of {amount}. Confirm to complete."),
    REPAYMENT_CONFIRMED("Repayment Confirmed",
            "{name} confirmed your repayment of {amount}.{detail}"),
    REPAYMENT_REJECTED("Repayment Rejected",
            "{name} rejected your repayment confirmation{detail}. Please verify your payment proof."),
    DEBT_FORGIVEN("Debt Forgiven",
            "{name} has forgiven your debt of {amount}. No repayment needed!"),
    REPAYMENT_REMINDER("Repayment Reminder",
            "{name} is reminding you to repay {amount}.{detail}"),
    PAYMENT_NOT_RECEIVED("Payment Not Received",
            "{name} reported that the {amount} you sent has not arrived."),
    TASK_ASSIGNED("New Task Assigned",
            "{name} assigned you a task{detail}"),
    TASK_ACCEPTED("Task Accepted",
            "{name} accepted your task{detail}"),
    TASK_DECLINED("Task Declined",
            "{name} declined your task{detail}"),
    TASK_STARTED("Task Status Update",
            "{name} started working on your task{detail}"),
    TASK_COMPLETED("Task Completed",
            "{name} completed your task{detail}"),
    TASK_CONFIRMED("Task Confirmed",
            "{name} confirmed your task and credited {amount} to your loan{detail}"),
    TASK_CANCELLED("Task Cancelled",
            "{name} cancelled the task{detail}"),
    DISPUTE_RAISED("Dispute Raised",
            "{name} raised a dispute on your transaction of {amount}{detail}"),
    DISPUTE_RESOLVED("Dispute Resolved",
            "The dispute on your transaction of {amount} was resolved{detail}");

    private final String title;
    private final String bodyTemplate;

    NotificationEvent(String title, String bodyTemplate) {
        this.title = title;
        this.bodyTemplate = bodyTemplate;
    }

    public String title() {
        return title;
    }

    public String render(String actorName, String amount, String detail) {
        return bodyTemplate
                .replace("{name}", actorName == null ? "" : actorName)
                .replace("{amount}", amount == null ? "" : amount)
                .replace("{detail}", detail == null ? "" : detail);
    }
}
