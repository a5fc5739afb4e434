package com.nosota.lingodesk.repository;

import com.nosota.lingodesk.model.CreditTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, Long> {
    List<CreditTransaction> findByAccountIdOrderByCreatedAtDescIdDesc(Long accountId);

    List<CreditTransaction> findByTeamIdOrderByCreatedAtDescIdDesc(Long teamId);

    /**
     * Sum of all ledger entries of an account, 0 when there are none.
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM CreditTransaction t WHERE t.accountId = :accountId")
    long sumByAccountId(@Param("accountId") Long accountId);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM CreditTransaction t WHERE t.teamId = :teamId")
    long sumByTeamId(@Param("teamId") Long teamId);
}
