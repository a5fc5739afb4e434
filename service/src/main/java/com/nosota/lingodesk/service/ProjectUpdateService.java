package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.UpdateType;
import com.nosota.lingodesk.api.request.CreateProjectUpdateRequest;
import com.nosota.lingodesk.model.ProjectUpdate;
import com.nosota.lingodesk.model.TranslationRequest;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.ProjectUpdateRepository;
import com.nosota.lingodesk.repository.TranslationRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Append-only project updates on translation requests.
 * <p>
 * A {@code status_change} update and the resulting status of its parent request are written in the
 * same transaction.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectUpdateService {

    private final ProjectUpdateRepository projectUpdateRepository;
    private final TranslationRequestRepository translationRequestRepository;
    private final TranslationRequestService translationRequestService;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if a {@code status_change} update carries no new status
     */
    @Transactional
    public ProjectUpdate addUpdate(User user, Long requestId, CreateProjectUpdateRequest request) {
        TranslationRequest order = translationRequestService.get(user, requestId);
        UpdateType type = Objects.requireNonNullElse(request.updateType(), UpdateType.NOTE);

        LocalDateTime now = LocalDateTime.now(clock);
        if (type == UpdateType.STATUS_CHANGE) {
            if (request.newStatus() == null) {
                throw new IllegalArgumentException("newStatus is required for status_change updates");
            }
            translationRequestService.changeStatus(order, request.newStatus());
            order.setUpdatedAt(now);
            translationRequestRepository.save(order);
        }

        ProjectUpdate update = new ProjectUpdate();
        update.setRequestId(order.getId());
        update.setUserId(user.getId());
        update.setUpdateText(request.updateText().trim());
        update.setUpdateType(type);
        update.setNewStatus(type == UpdateType.STATUS_CHANGE ? request.newStatus() : null);
        update.setCreatedAt(now);
        update = projectUpdateRepository.save(update);

        log.info("Project update added: id={}, requestId={}, type={}", update.getId(), requestId, type);
        return update;
    }

    /**
     * Updates of one request, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ProjectUpdate> listUpdates(User user, Long requestId) {
        translationRequestService.get(user, requestId);
        return projectUpdateRepository.findByRequestIdOrderByCreatedAtAscIdAsc(requestId);
    }
}
