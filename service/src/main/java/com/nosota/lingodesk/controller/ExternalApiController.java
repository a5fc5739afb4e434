package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.ExternalApi;
import com.nosota.lingodesk.api.dto.PagedResponse;
import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.request.CreateProjectUpdateRequest;
import com.nosota.lingodesk.api.request.CreateTranslationRequest;
import com.nosota.lingodesk.api.request.UpdateTranslationRequest;
import com.nosota.lingodesk.api.response.*;
import com.nosota.lingodesk.config.LingodeskProperties;
import com.nosota.lingodesk.mapper.TranslationRequestMapper;
import com.nosota.lingodesk.mapper.UserMapper;
import com.nosota.lingodesk.model.TranslationRequest;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.security.CurrentUserProvider;
import com.nosota.lingodesk.service.AccountService;
import com.nosota.lingodesk.service.ProjectUpdateService;
import com.nosota.lingodesk.service.TranslationRequestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The {@code /api/v1} surface for machine clients authenticated by API key.
 *
 * <p>Uses the same services as the session surface, with leaner response envelopes.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ExternalApiController implements ExternalApi {

    private final TranslationRequestService translationRequestService;
    private final ProjectUpdateService projectUpdateService;
    private final AccountService accountService;
    private final CurrentUserProvider currentUserProvider;
    private final LingodeskProperties properties;

    @Override
    public ResponseEntity<OrderCreatedResponse> createTranslationRequest(CreateTranslationRequest request) {
        TranslationRequest order = translationRequestService.create(currentUserProvider.requireUser(), request);
        LocalDateTime estimatedCompletion = order.getCreatedAt().plus(properties.getOrders().getEstimatedCompletion());
        return ResponseEntity.status(HttpStatus.CREATED).body(new OrderCreatedResponse(
                order.getId(),
                order.getStatus(),
                order.getCreditsRequired(),
                order.getTotalCost(),
                estimatedCompletion));
    }

    @Override
    public ResponseEntity<PagedResponse<OrderSummaryResponse>> listTranslationRequests(
            String status, LocalDateTime dateFrom, LocalDateTime dateTo, int limit, int offset) {
        OrderStatus statusFilter = StringUtils.hasText(status) ? OrderStatus.fromValue(status.trim()) : null;
        PagedResponse<TranslationRequest> page = translationRequestService.search(
                currentUserProvider.requireUser(), statusFilter, dateFrom, dateTo, limit, offset);
        return ResponseEntity.ok(new PagedResponse<>(
                page.totalCount(),
                TranslationRequestMapper.INSTANCE.toSummaryList(page.results())));
    }

    @Override
    public ResponseEntity<TranslationRequestResponse> getTranslationRequest(Long id) {
        User user = currentUserProvider.requireUser();
        TranslationRequest order = translationRequestService.get(user, id);
        List<ProjectUpdateResponse> updates =
                TranslationRequestMapper.INSTANCE.toUpdateResponseList(projectUpdateService.listUpdates(user, id));
        return ResponseEntity.ok(TranslationRequestMapper.INSTANCE.toResponse(order).withUpdates(updates));
    }

    @Override
    public ResponseEntity<OrderUpdatedResponse> updateTranslationRequest(Long id, UpdateTranslationRequest request) {
        TranslationRequest order = translationRequestService.update(currentUserProvider.requireUser(), id, request);
        return ResponseEntity.ok(new OrderUpdatedResponse(
                order.getId(), order.getStatus(), order.getCompletionPercentage(), order.getUpdatedAt()));
    }

    @Override
    public ResponseEntity<ProjectUpdateResponse> addTranslationRequestUpdate(Long id, CreateProjectUpdateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TranslationRequestMapper.INSTANCE.toResponse(
                projectUpdateService.addUpdate(currentUserProvider.requireUser(), id, request)));
    }

    @Override
    public ResponseEntity<AccountResponse> getAccount() {
        return ResponseEntity.ok(accountService.getAccount(currentUserProvider.requireUser().getAccountId()));
    }

    @Override
    public ResponseEntity<List<UserResponse>> getAccountUsers() {
        User user = currentUserProvider.requireUser();
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponseList(accountService.getAccountUsers(user.getAccountId())));
    }

    @Override
    public ResponseEntity<UserResponse> getUser() {
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(currentUserProvider.requireUser()));
    }
}
