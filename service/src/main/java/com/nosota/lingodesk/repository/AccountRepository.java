package com.nosota.lingodesk.repository;

import com.nosota.lingodesk.model.Account;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {
    /**
     * Retrieves the {@link Account} with the given id and locks its row for update.
     * <p>
     * Used by credit top-ups so that the balance read, the increment and the ledger insert
     * are serialized per account. Keep the surrounding transaction short.
     * </p>
     *
     * @param id account id
     * @return the locked account, empty if no such account exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.id = :id")
    Optional<Account> getOneForUpdate(@Param("id") Long id);
}
