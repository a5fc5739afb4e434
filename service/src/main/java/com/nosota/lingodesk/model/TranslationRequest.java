package com.nosota.lingodesk.model;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.Priority;
import com.nosota.lingodesk.api.model.Workflow;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A translation order: one uploaded document, its target languages and the chosen workflow tier.
 * <p>
 * Orders are never deleted. {@code status}, {@code priority}, {@code completionPercentage},
 * {@code dueDate} and {@code assignedTo} are the only fields changed after submission.
 * </p>
 */
@Entity
@Table(name = "translation_requests")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TranslationRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * Account of the submitting user, copied at creation so administrators can list
     * every order of their account.
     */
    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "file_name", nullable = false, length = 500)
    private String fileName;

    @Column(name = "file_format", nullable = false, length = 100)
    private String fileFormat;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "word_count", nullable = false)
    private Long wordCount;

    @Column(name = "character_count", nullable = false)
    private Long characterCount;

    @Column(name = "images_with_text", nullable = false)
    private Integer imagesWithText;

    @Column(name = "subject_matter", nullable = false)
    private String subjectMatter;

    @Column(name = "source_language", nullable = false, length = 100)
    private String sourceLanguage;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "translation_request_target_languages", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "position")
    @Column(name = "language", nullable = false)
    private List<String> targetLanguages = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private Workflow workflow;

    @Column(name = "credits_required", nullable = false)
    private Long creditsRequired;

    /**
     * Formatted price, e.g. {@code £2.00}.
     */
    @Column(name = "total_cost", nullable = false, length = 32)
    private String totalCost;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private OrderStatus status = OrderStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Priority priority = Priority.MEDIUM;

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    /**
     * 0..100, unrelated to {@code status}.
     */
    @Column(name = "completion_percentage", nullable = false)
    private Integer completionPercentage = 0;

    @Column(name = "assigned_to")
    private String assignedTo;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
