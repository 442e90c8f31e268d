package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.TaskStatus;
import com.good4it.lendingservice.model.TransactionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MoneyTransactionRepository extends JpaRepository<MoneyTransaction, UUID> {

    boolean existsByRequestId(UUID requestId);

    Optional<MoneyTransaction> findByRequestId(UUID requestId);

    @Query("""
            select t from MoneyTransaction t
            where t.requestorId = :userId or t.lenderId = :userId
            order by t.createdAt desc
            """)
    List<MoneyTransaction> findAllInvolving(@Param("userId") UUID userId);

    @Query("""
            select t from MoneyTransaction t
            where (t.lenderId = :userId and t.requestorId = :friendId)
               or (t.lenderId = :friendId and t.requestorId = :userId)
            order by t.createdAt desc
            """)
    List<MoneyTransaction> findBetween(@Param("userId") UUID userId, @Param("friendId") UUID friendId, Pageable pageable);

    List<MoneyTransaction> findByLenderIdAndStatusInOrderByCreatedAtAsc(UUID lenderId, Collection<TransactionStatus> statuses);

    List<MoneyTransaction> findByRequestorIdAndStatusInOrderByCreatedAtAsc(UUID requestorId, Collection<TransactionStatus> statuses);

    @Query("""
            select t from MoneyTransaction t
            where t.lenderId = :lenderId and t.status in :statuses
              and not exists (
                  select k.id from Task k
                  where k.referenceTransactionId = t.id and k.status in :openTaskStatuses)
            order by t.createdAt asc
            """)
    List<MoneyTransaction> findWithoutOpenTask(@Param("lenderId") UUID lenderId,
                                               @Param("statuses") Collection<TransactionStatus> statuses,
                                               @Param("openTaskStatuses") Collection<TaskStatus> openTaskStatuses);

    @Query("""
            select t.status as status, count(t) as transactions, sum(t.amount) as amount,
                   sum(t.repaymentAmount) as repaid, sum(t.forgivenAmount) as forgiven
            from MoneyTransaction t
            where t.lenderId = :userId
            group by t.status
            """)
    List<StatusTotal> totalsAsLender(@Param("userId") UUID userId);

    @Query("""
            select t.status as status, count(t) as transactions, sum(t.amount) as amount,
                   sum(t.repaymentAmount) as repaid, sum(t.forgivenAmount) as forgiven
            from MoneyTransaction t
            where t.requestorId = :userId
            group by t.status
            """)
    List<StatusTotal> totalsAsBorrower(@Param("userId") UUID userId);

    @Query("""
            select t.status as status, count(t) as transactions, sum(t.amount) as amount,
                   sum(t.repaymentAmount) as repaid, sum(t.forgivenAmount) as forgiven
            from MoneyTransaction t
            where t.lenderId = :lenderId and t.requestorId = :borrowerId
            group by t.status
            """)
    List<StatusTotal> totalsBetween(@Param("lenderId") UUID lenderId, @Param("borrowerId") UUID borrowerId);

    interface StatusTotal {
        TransactionStatus getStatus();

        long getTransactions();

        BigDecimal getAmount();

        BigDecimal getRepaid();

        // null when nothing in the group was forgiven
        BigDecimal getForgiven();
    }
}
