package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.dto.PagedResponse;
import com.nosota.lingodesk.api.request.CreateProjectUpdateRequest;
import com.nosota.lingodesk.api.request.CreateTranslationRequest;
import com.nosota.lingodesk.api.request.UpdateTranslationRequest;
import com.nosota.lingodesk.api.response.AccountResponse;
import com.nosota.lingodesk.api.response.OrderCreatedResponse;
import com.nosota.lingodesk.api.response.OrderSummaryResponse;
import com.nosota.lingodesk.api.response.OrderUpdatedResponse;
import com.nosota.lingodesk.api.response.ProjectUpdateResponse;
import com.nosota.lingodesk.api.response.TranslationRequestResponse;
import com.nosota.lingodesk.api.response.UserResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.time.LocalDateTime;
import java.util.List;

/**
 * API-key surface for machine clients.
 *
 * <p>Every call carries {@code Authorization: Bearer <api key>}. Keys are issued per user
 * through {@code POST /api/user/api-keys} and act on behalf of that user.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>ExternalApiController - in service module (server-side implementation)</li>
 *   <li>LingodeskClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1")
public interface ExternalApi {

    /**
     * Submits an order.
     *
     * @return 201 with id, status, credits, price and an estimated completion time
     */
    @PostMapping("/translation-requests")
    ResponseEntity<OrderCreatedResponse> createTranslationRequest(@RequestBody @Valid CreateTranslationRequest request);

    /**
     * Lists the caller's orders, newest first.
     *
     * @param status   Optional status filter ({@code pending}, {@code complete}, ...)
     * @param dateFrom Optional lower bound on creation time, inclusive
     * @param dateTo   Optional upper bound on creation time, inclusive
     * @param limit    Page size, 1..500, default 50
     * @param offset   Records to skip, default 0
     * @return {@code {totalCount, results}}
     */
    @GetMapping("/translation-requests")
    ResponseEntity<PagedResponse<OrderSummaryResponse>> listTranslationRequests(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "dateFrom", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @RequestParam(value = "dateTo", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo,
            @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(500) int limit,
            @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset);

    @GetMapping("/translation-requests/{id}")
    ResponseEntity<TranslationRequestResponse> getTranslationRequest(@PathVariable("id") Long id);

    @PatchMapping("/translation-requests/{id}")
    ResponseEntity<OrderUpdatedResponse> updateTranslationRequest(@PathVariable("id") Long id,
                                                                  @RequestBody @Valid UpdateTranslationRequest request);

    @PostMapping("/translation-requests/{id}/updates")
    ResponseEntity<ProjectUpdateResponse> addTranslationRequestUpdate(@PathVariable("id") Long id,
                                                                      @RequestBody @Valid CreateProjectUpdateRequest request);

    @GetMapping("/account")
    ResponseEntity<AccountResponse> getAccount();

    @GetMapping("/account/users")
    ResponseEntity<List<UserResponse>> getAccountUsers();

    @GetMapping("/user")
    ResponseEntity<UserResponse> getUser();
}
