package com.nosota.lingodesk.model;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.UpdateType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Append-only note attached to a {@link TranslationRequest}.
 * <p>
 * A {@link UpdateType#STATUS_CHANGE} update carries {@code newStatus}, which is applied to the
 * parent request in the same transaction that stores the update.
 * </p>
 */
@Entity
@Table(name = "project_updates")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ProjectUpdate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false)
    private Long requestId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "update_text", nullable = false, length = 4000)
    private String updateText;

    @Enumerated(EnumType.STRING)
    @Column(name = "update_type", nullable = false, length = 20)
    private UpdateType updateType;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", length = 40)
    private OrderStatus newStatus;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
