package com.flagship.budget_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, UUID> {

    Optional<LoanEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<LoanEntity> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

    List<LoanEntity> findByOwnerIdAndStatusOrderByCreatedAtAsc(UUID ownerId, LoanStatus status);

    @Query("SELECT l FROM LoanEntity l WHERE l.ownerId = :ownerId " +
           "AND (l.lenderAccountId = :accountId OR l.borrowerAccountId = :accountId) " +
           "ORDER BY l.createdAt ASC")
    List<LoanEntity> findByOwnerIdAndAccount(@Param("ownerId") UUID ownerId, @Param("accountId") UUID accountId);
}
