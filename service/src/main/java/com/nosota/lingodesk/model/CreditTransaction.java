package com.nosota.lingodesk.model;

import com.nosota.lingodesk.api.model.CreditTransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Credit ledger entry - append-only.
 *
 * <p>Exactly one of {@code accountId} and {@code teamId} is set (CHECK constraint in V1).
 * The amount is signed: top-ups are positive.
 */
@Entity
@Table(name = "credit_transactions")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CreditTransaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id")
    private Long accountId;

    @Column(name = "team_id")
    private Long teamId;

    /**
     * User who caused the entry; null for system grants.
     */
    @Column(name = "user_id")
    private Long userId;

    @Column(nullable = false)
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private CreditTransactionType type;

    @Column(length = 500)
    private String description;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
