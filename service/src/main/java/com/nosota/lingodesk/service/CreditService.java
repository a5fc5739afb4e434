package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.CreditTransactionType;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.CreditTransaction;
import com.nosota.lingodesk.model.Team;
import com.nosota.lingodesk.error.ResourceNotFoundException;
import com.nosota.lingodesk.repository.AccountRepository;
import com.nosota.lingodesk.repository.CreditTransactionRepository;
import com.nosota.lingodesk.repository.TeamRepository;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Credit ledger for accounts and teams.
 *
 * <p>Every balance change is a pair of writes made in one transaction:
 * <ol>
 *   <li>the owner row is locked with {@code SELECT ... FOR UPDATE} and its balance incremented</li>
 *   <li>an append-only {@link CreditTransaction} with the same signed amount is inserted</li>
 * </ol>
 * Either both are committed or neither, so a balance always equals the sum of its ledger entries.
 * Concurrent top-ups on the same owner are serialized by the row lock.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CreditService {

    private final AccountRepository accountRepository;
    private final TeamRepository teamRepository;
    private final CreditTransactionRepository creditTransactionRepository;
    private final Clock clock;

    /**
     * Adds credits to an account balance and records the ledger entry.
     *
     * @param accountId   account to credit
     * @param amount      positive number of credits
     * @param type        origin of the credits
     * @param description optional free text
     * @param actorUserId user performing the operation, null for system grants
     * @return the new balance
     * @throws ResourceNotFoundException if the account does not exist
     */
    @Transactional
    public long addAccountCredits(@NotNull Long accountId,
                                  @NotNull @Positive(message = "Amount must be a positive integer") Long amount,
                                  @NotNull CreditTransactionType type,
                                  String description,
                                  Long actorUserId) {
        Account account = accountRepository.getOneForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));

        account.setCredits(Math.addExact(account.getCredits(), amount));
        accountRepository.save(account);

        CreditTransaction entry = newEntry(amount, type, description, actorUserId);
        entry.setAccountId(accountId);
        creditTransactionRepository.save(entry);

        log.info("Credited account: accountId={}, amount={}, type={}, balance={}",
                accountId, amount, type, account.getCredits());
        return account.getCredits();
    }

    /**
     * Same as {@link #addAccountCredits} for a team balance.
     */
    @Transactional
    public long addTeamCredits(@NotNull Long teamId,
                               @NotNull @Positive(message = "Amount must be a positive integer") Long amount,
                               @NotNull CreditTransactionType type,
                               String description,
                               Long actorUserId) {
        Team team = teamRepository.getOneForUpdate(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));

        team.setCredits(Math.addExact(team.getCredits(), amount));
        team.setUpdatedAt(LocalDateTime.now(clock));
        teamRepository.save(team);

        CreditTransaction entry = newEntry(amount, type, description, actorUserId);
        entry.setTeamId(teamId);
        creditTransactionRepository.save(entry);

        log.info("Credited team: teamId={}, amount={}, type={}, balance={}",
                teamId, amount, type, team.getCredits());
        return team.getCredits();
    }

    @Transactional(readOnly = true)
    public List<CreditTransaction> getAccountTransactions(Long accountId) {
        return creditTransactionRepository.findByAccountIdOrderByCreatedAtDescIdDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<CreditTransaction> getTeamTransactions(Long teamId) {
        return creditTransactionRepository.findByTeamIdOrderByCreatedAtDescIdDesc(teamId);
    }

    private CreditTransaction newEntry(Long amount, CreditTransactionType type, String description, Long actorUserId) {
        CreditTransaction entry = new CreditTransaction();
        entry.setAmount(amount);
        entry.setType(type);
        entry.setDescription(description);
        entry.setUserId(actorUserId);
        entry.setCreatedAt(LocalDateTime.now(clock));
        return entry;
    }
}
