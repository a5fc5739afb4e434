package com.nosota.lingodesk.tests;

import com.nosota.lingodesk.TestBase;
import com.nosota.lingodesk.api.model.CreditTransactionType;
import com.nosota.lingodesk.error.ResourceNotFoundException;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.Team;
import com.nosota.lingodesk.repository.CreditTransactionRepository;
import com.nosota.lingodesk.repository.TeamRepository;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ledger consistency of {@link com.nosota.lingodesk.service.CreditService}.
 */
public class CreditServiceTest extends TestBase {

    @Autowired
    private CreditTransactionRepository creditTransactionRepository;

    @Autowired
    private TeamRepository teamRepository;

    @Test
    public void balanceEqualsLedgerSum() {
        Account account = createAccount("Ledger " + nextUnique());

        creditService.addAccountCredits(account.getId(), 100L, CreditTransactionType.SIGNUP_BONUS, "Signup bonus", null);
        creditService.addAccountCredits(account.getId(), 40L, CreditTransactionType.ADMIN_ADJUSTMENT, null, null);
        long balance = creditService.addAccountCredits(account.getId(), 2L, CreditTransactionType.PURCHASE, "Top-up", null);

        assertThat(balance).isEqualTo(142L);
        assertThat(accountRepository.findById(account.getId()).orElseThrow().getCredits()).isEqualTo(142L);
        assertThat(creditTransactionRepository.sumByAccountId(account.getId())).isEqualTo(142L);
        assertThat(creditService.getAccountTransactions(account.getId())).hasSize(3);
    }

    @Test
    public void nonPositiveAmountIsRejected() {
        Account account = createAccount("Rejected " + nextUnique());

        assertThatThrownBy(() -> creditService.addAccountCredits(
                account.getId(), 0L, CreditTransactionType.ADMIN_ADJUSTMENT, null, null))
                .isInstanceOf(ConstraintViolationException.class);
        assertThatThrownBy(() -> creditService.addAccountCredits(
                account.getId(), -5L, CreditTransactionType.ADMIN_ADJUSTMENT, null, null))
                .isInstanceOf(ConstraintViolationException.class);

        assertThat(creditTransactionRepository.sumByAccountId(account.getId())).isZero();
    }

    @Test
    public void unknownAccountIsNotFound() {
        assertThatThrownBy(() -> creditService.addAccountCredits(
                987_654_321L, 10L, CreditTransactionType.ADMIN_ADJUSTMENT, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    public void teamCreditsAreRecordedSeparately() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        Team team = new Team();
        team.setName("Ledger team " + nextUnique());
        team.setCreatedAt(now);
        team.setUpdatedAt(now);
        team = teamRepository.save(team);

        long balance = creditService.addTeamCredits(team.getId(), 75L, CreditTransactionType.ADMIN_ADJUSTMENT, null, null);

        assertThat(balance).isEqualTo(75L);
        assertThat(creditTransactionRepository.sumByTeamId(team.getId())).isEqualTo(75L);
        assertThat(creditService.getTeamTransactions(team.getId()))
                .singleElement()
                .satisfies(entry -> assertThat(entry.getAccountId()).isNull());
    }

    @Test
    public void concurrentTopUpsDoNotLoseUpdates() throws Exception {
        Account account = createAccount("Concurrent " + nextUnique());
        int threads = 4;
        int perThread = 10;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(CompletableFuture.runAsync(() -> {
                    for (int i = 0; i < perThread; i++) {
                        creditService.addAccountCredits(account.getId(), 1L,
                                CreditTransactionType.ADMIN_ADJUSTMENT, null, null);
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }

        long expected = (long) threads * perThread;
        assertThat(accountRepository.findById(account.getId()).orElseThrow().getCredits()).isEqualTo(expected);
        assertThat(creditTransactionRepository.sumByAccountId(account.getId())).isEqualTo(expected);
    }
}
