package com.good4it.lendingservice.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record FriendBalanceResponse(
        UUID friendId,
        BigDecimal lentToFriend,
        BigDecimal borrowedFromFriend,
        BigDecimal repaidByFriend,
        BigDecimal repaidToFriend,
        BigDecimal friendOwes,
        BigDecimal youOwe,
        BigDecimal netBalance,
        long transactionCount,
        List<TransactionResponse> recentTransactions
) {
}
