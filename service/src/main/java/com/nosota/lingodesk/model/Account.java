package com.nosota.lingodesk.model;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Billing and membership container for a set of users.
 * <p>
 * {@code credits} is a denormalized balance. It only changes through {@link com.nosota.lingodesk.service.CreditService},
 * which writes the matching {@link CreditTransaction} in the same database transaction,
 * so the balance always equals the sum of the account's ledger entries.
 * </p>
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Account {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /**
     * Credit balance, never negative.
     */
    @Column(nullable = false)
    private Long credits = 0L;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_plan", nullable = false, length = 20)
    private SubscriptionPlan subscriptionPlan = SubscriptionPlan.FREE;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_status", nullable = false, length = 20)
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.ACTIVE;

    @Column(name = "subscription_renewal")
    private LocalDateTime subscriptionRenewal;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
