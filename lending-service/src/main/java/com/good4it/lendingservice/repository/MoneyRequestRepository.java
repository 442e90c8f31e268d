package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.MoneyRequest;
import com.good4it.lendingservice.model.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface MoneyRequestRepository extends JpaRepository<MoneyRequest, UUID> {

    List<MoneyRequest> findByRequestorIdOrderByCreatedAtDesc(UUID requestorId);

    List<MoneyRequest> findByLenderIdOrderByCreatedAtDesc(UUID lenderId);

    @Query("""
            select r from MoneyRequest r
            where (r.requestorId = :userId or r.lenderId = :userId)
            order by r.createdAt desc
            """)
    List<MoneyRequest> findAllInvolving(@Param("userId") UUID userId);

    @Query("""
            select r from MoneyRequest r
            where (r.requestorId = :userId or r.lenderId = :userId)
              and r.status = :status
            order by r.createdAt desc
            """)
    List<MoneyRequest> findAllInvolvingWithStatus(@Param("userId") UUID userId, @Param("status") RequestStatus status);

    @Query("""
            select r.status as status, count(r) as requests, sum(r.amount) as amount
            from MoneyRequest r
            where r.requestorId = :userId
            group by r.status
            """)
    List<StatusTotal> totalsAsRequestor(@Param("userId") UUID userId);

    @Query("""
            select r.status as status, count(r) as requests, sum(r.amount) as amount
            from MoneyRequest r
            where r.lenderId = :userId
            group by r.status
            """)
    List<StatusTotal> totalsAsLender(@Param("userId") UUID userId);

    interface StatusTotal {
        RequestStatus getStatus();

        long getRequests();

        BigDecimal getAmount();
    }
}
