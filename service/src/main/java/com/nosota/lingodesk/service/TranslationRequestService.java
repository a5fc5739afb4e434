package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.dto.PagedResponse;
import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.Priority;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.api.request.CreateTranslationRequest;
import com.nosota.lingodesk.api.request.UpdateTranslationRequest;
import com.nosota.lingodesk.api.response.EstimateResponse;
import com.nosota.lingodesk.error.ResourceNotFoundException;
import com.nosota.lingodesk.model.TranslationRequest;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.OffsetPageRequest;
import com.nosota.lingodesk.repository.TranslationRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Submission, listing and project tracking of translation orders.
 *
 * <p>Credits and price are always computed here with {@link CostEstimator}; values a client
 * might send are not trusted. Submitting an order does not debit the account balance.
 *
 * <p>Visibility: the submitting user, and administrators of the same account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationRequestService {

    private final TranslationRequestRepository translationRequestRepository;
    private final CostEstimator costEstimator;
    private final OrderStatusStateMachine statusStateMachine;
    private final Clock clock;

    @Transactional
    public TranslationRequest create(User user, CreateTranslationRequest request) {
        List<String> targetLanguages = request.targetLanguages().stream()
                .map(String::trim)
                .toList();
        EstimateResponse estimate = costEstimator.estimate(
                request.characterCount(), targetLanguages.size(), request.workflow());

        LocalDateTime now = LocalDateTime.now(clock);
        TranslationRequest order = new TranslationRequest();
        order.setUserId(user.getId());
        order.setAccountId(user.getAccountId());
        order.setFileName(request.fileName().trim());
        order.setFileFormat(StringUtils.hasText(request.fileFormat())
                ? request.fileFormat().trim()
                : formatFromFileName(request.fileName()));
        order.setFileSize(Objects.requireNonNullElse(request.fileSize(), 0L));
        order.setWordCount(Objects.requireNonNullElse(request.wordCount(), 0L));
        order.setCharacterCount(request.characterCount());
        order.setImagesWithText(Objects.requireNonNullElse(request.imagesWithText(), 0));
        order.setSubjectMatter(StringUtils.hasText(request.subjectMatter())
                ? request.subjectMatter().trim()
                : ContentClassifier.GENERAL_CONTENT);
        order.setSourceLanguage(request.sourceLanguage().trim());
        order.setTargetLanguages(new ArrayList<>(targetLanguages));
        order.setWorkflow(request.workflow());
        order.setCreditsRequired(estimate.creditsRequired());
        order.setTotalCost(estimate.totalCost());
        order.setStatus(OrderStatus.PENDING);
        order.setPriority(Objects.requireNonNullElse(request.priority(), Priority.MEDIUM));
        order.setDueDate(request.dueDate());
        order.setCompletionPercentage(0);
        order.setCreatedAt(now);
        order.setUpdatedAt(now);
        order = translationRequestRepository.save(order);

        log.info("Translation request created: id={}, userId={}, workflow={}, languages={}, credits={}",
                order.getId(), user.getId(), order.getWorkflow(), targetLanguages.size(), order.getCreditsRequired());
        return order;
    }

    /**
     * Administrators get every order of their account, other users their own. Newest first.
     */
    @Transactional(readOnly = true)
    public List<TranslationRequest> list(User user) {
        if (user.getRole() == UserRole.ADMIN) {
            return translationRequestRepository.findByAccountIdOrderByCreatedAtDescIdDesc(user.getAccountId());
        }
        return translationRequestRepository.findByUserIdOrderByCreatedAtDescIdDesc(user.getId());
    }

    /**
     * The caller's own orders, filtered and paged by offset.
     *
     * @param status   exact status, null for any
     * @param dateFrom inclusive lower bound on creation time, null for none
     * @param dateTo   inclusive upper bound on creation time, null for none
     * @param limit    maximum number of results
     * @param offset   number of matching orders to skip
     */
    @Transactional(readOnly = true)
    public PagedResponse<TranslationRequest> search(User user, OrderStatus status,
                                                    LocalDateTime dateFrom, LocalDateTime dateTo,
                                                    int limit, int offset) {
        Page<TranslationRequest> page = translationRequestRepository.search(
                user.getId(), status, dateFrom, dateTo, new OffsetPageRequest(offset, limit));
        return new PagedResponse<>(page.getTotalElements(), page.getContent());
    }

    /**
     * @throws ResourceNotFoundException if there is no such order
     * @throws AccessDeniedException     if the caller may not see it
     */
    @Transactional(readOnly = true)
    public TranslationRequest get(User user, Long id) {
        TranslationRequest order = translationRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Translation request", id));
        checkAccess(user, order);
        return order;
    }

    /**
     * Applies the non-null fields of the request. A status change goes through the
     * {@link OrderStatusStateMachine}.
     */
    @Transactional
    public TranslationRequest update(User user, Long id, UpdateTranslationRequest request) {
        TranslationRequest order = get(user, id);

        if (request.status() != null) {
            changeStatus(order, request.status());
        }
        if (request.priority() != null) {
            order.setPriority(request.priority());
        }
        if (request.completionPercentage() != null) {
            order.setCompletionPercentage(request.completionPercentage());
        }
        if (request.dueDate() != null) {
            order.setDueDate(request.dueDate());
        }
        if (request.assignedTo() != null) {
            order.setAssignedTo(request.assignedTo().isBlank() ? null : request.assignedTo().trim());
        }
        order.setUpdatedAt(LocalDateTime.now(clock));

        log.info("Translation request updated: id={}, userId={}", id, user.getId());
        return translationRequestRepository.save(order);
    }

    /**
     * Moves an order to a new status after checking the transition. Does not save.
     */
    public void changeStatus(TranslationRequest order, OrderStatus newStatus) {
        OrderStatus current = order.getStatus();
        statusStateMachine.validateTransition(current, newStatus);
        if (current != newStatus) {
            order.setStatus(newStatus);
            log.info("Translation request status changed: id={}, {} -> {}",
                    order.getId(), current.getValue(), newStatus.getValue());
        }
    }

    public void checkAccess(User user, TranslationRequest order) {
        boolean owner = Objects.equals(order.getUserId(), user.getId());
        boolean accountAdmin = user.getRole() == UserRole.ADMIN
                && Objects.equals(order.getAccountId(), user.getAccountId());
        if (!owner && !accountAdmin) {
            throw new AccessDeniedException("Access denied to translation request " + order.getId());
        }
    }

    static String formatFromFileName(String fileName) {
        String extension = FileAnalysisService.extensionOf(fileName.trim());
        return extension.isEmpty() ? "UNKNOWN" : extension.toUpperCase(Locale.ROOT);
    }
}
