package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.request.CreateProjectUpdateRequest;
import com.nosota.lingodesk.api.request.CreateTranslationRequest;
import com.nosota.lingodesk.api.request.UpdateTranslationRequest;
import com.nosota.lingodesk.api.response.ProjectUpdateResponse;
import com.nosota.lingodesk.api.response.TranslationRequestResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

/**
 * Translation request (order) API for session-authenticated users.
 *
 * <p>Orders are created in status {@code pending} and tracked through the status pipeline
 * by direct updates or by {@code status_change} project updates.
 */
@RequestMapping("/api/translation-requests")
public interface TranslationRequestApi {

    /**
     * Submits a new order. Credits and price are computed by the server.
     *
     * @param request Order data
     * @return 201 with the created order
     */
    @PostMapping
    ResponseEntity<TranslationRequestResponse> create(@RequestBody @Valid CreateTranslationRequest request);

    /**
     * Lists orders visible to the caller: all orders of the account for administrators,
     * the caller's own orders otherwise. Newest first.
     */
    @GetMapping
    ResponseEntity<List<TranslationRequestResponse>> list();

    /**
     * Returns one order with its project updates, oldest update first.
     */
    @GetMapping("/{id}")
    ResponseEntity<TranslationRequestResponse> get(@PathVariable("id") Long id);

    /**
     * Updates the project-tracking fields of an order.
     */
    @PatchMapping("/{id}")
    ResponseEntity<TranslationRequestResponse> update(@PathVariable("id") Long id,
                                                      @RequestBody @Valid UpdateTranslationRequest request);

    /**
     * Appends a project update. A {@code status_change} update also sets the order status.
     */
    @PostMapping("/{id}/updates")
    ResponseEntity<ProjectUpdateResponse> addUpdate(@PathVariable("id") Long id,
                                                    @RequestBody @Valid CreateProjectUpdateRequest request);

    @GetMapping("/{id}/updates")
    ResponseEntity<List<ProjectUpdateResponse>> listUpdates(@PathVariable("id") Long id);
}
