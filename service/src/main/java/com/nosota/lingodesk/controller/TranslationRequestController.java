package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.TranslationRequestApi;
import com.nosota.lingodesk.api.request.CreateProjectUpdateRequest;
import com.nosota.lingodesk.api.request.CreateTranslationRequest;
import com.nosota.lingodesk.api.request.UpdateTranslationRequest;
import com.nosota.lingodesk.api.response.ProjectUpdateResponse;
import com.nosota.lingodesk.api.response.TranslationRequestResponse;
import com.nosota.lingodesk.mapper.TranslationRequestMapper;
import com.nosota.lingodesk.model.TranslationRequest;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.security.CurrentUserProvider;
import com.nosota.lingodesk.service.ProjectUpdateService;
import com.nosota.lingodesk.service.TranslationRequestService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for translation orders of the session (browser) surface.
 */
@RestController
@Validated
@RequiredArgsConstructor
public class TranslationRequestController implements TranslationRequestApi {

    private final TranslationRequestService translationRequestService;
    private final ProjectUpdateService projectUpdateService;
    private final CurrentUserProvider currentUserProvider;

    @Override
    public ResponseEntity<TranslationRequestResponse> create(CreateTranslationRequest request) {
        TranslationRequest order = translationRequestService.create(currentUserProvider.requireUser(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(TranslationRequestMapper.INSTANCE.toResponse(order));
    }

    @Override
    public ResponseEntity<List<TranslationRequestResponse>> list() {
        List<TranslationRequest> orders = translationRequestService.list(currentUserProvider.requireUser());
        return ResponseEntity.ok(TranslationRequestMapper.INSTANCE.toResponseList(orders));
    }

    @Override
    public ResponseEntity<TranslationRequestResponse> get(Long id) {
        User user = currentUserProvider.requireUser();
        TranslationRequest order = translationRequestService.get(user, id);
        List<ProjectUpdateResponse> updates =
                TranslationRequestMapper.INSTANCE.toUpdateResponseList(projectUpdateService.listUpdates(user, id));
        return ResponseEntity.ok(TranslationRequestMapper.INSTANCE.toResponse(order).withUpdates(updates));
    }

    @Override
    public ResponseEntity<TranslationRequestResponse> update(Long id, UpdateTranslationRequest request) {
        TranslationRequest order = translationRequestService.update(currentUserProvider.requireUser(), id, request);
        return ResponseEntity.ok(TranslationRequestMapper.INSTANCE.toResponse(order));
    }

    @Override
    public ResponseEntity<ProjectUpdateResponse> addUpdate(Long id, CreateProjectUpdateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TranslationRequestMapper.INSTANCE.toResponse(
                projectUpdateService.addUpdate(currentUserProvider.requireUser(), id, request)));
    }

    @Override
    public ResponseEntity<List<ProjectUpdateResponse>> listUpdates(Long id) {
        return ResponseEntity.ok(TranslationRequestMapper.INSTANCE.toUpdateResponseList(
                projectUpdateService.listUpdates(currentUserProvider.requireUser(), id)));
    }
}
