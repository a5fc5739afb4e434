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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * WebClient-based implementation of {@link ExternalApi} for consuming the lingodesk API-key surface.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class LingodeskClientConfig {
 *     @Bean
 *     public LingodeskClient lingodeskClient(WebClient.Builder builder,
 *                                            @Value("${services.lingodesk.url}") String baseUrl,
 *                                            @Value("${services.lingodesk.api-key}") String apiKey) {
 *         return LingodeskClient.create(builder, baseUrl, apiKey);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class LingodeskClient implements ExternalApi {

    private final WebClient webClient;

    /**
     * Builds a client that sends {@code apiKey} as a bearer token on every call.
     */
    public static LingodeskClient create(WebClient.Builder builder, String baseUrl, String apiKey) {
        WebClient webClient = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        return new LingodeskClient(webClient);
    }

    @Override
    public ResponseEntity<OrderCreatedResponse> createTranslationRequest(CreateTranslationRequest request) {
        log.debug("Calling createTranslationRequest: fileName={}, workflow={}, targetLanguages={}",
                request.fileName(), request.workflow(), request.targetLanguages());

        return webClient.post()
                .uri("/api/v1/translation-requests")
                .bodyValue(request)
                .retrieve()
                .toEntity(OrderCreatedResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<OrderSummaryResponse>> listTranslationRequests(
            String status, LocalDateTime dateFrom, LocalDateTime dateTo, int limit, int offset) {
        log.debug("Calling listTranslationRequests: status={}, dateFrom={}, dateTo={}, limit={}, offset={}",
                status, dateFrom, dateTo, limit, offset);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/translation-requests")
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParamIfPresent("dateFrom", Optional.ofNullable(dateFrom))
                        .queryParamIfPresent("dateTo", Optional.ofNullable(dateTo))
                        .queryParam("limit", limit)
                        .queryParam("offset", offset)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<OrderSummaryResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<TranslationRequestResponse> getTranslationRequest(Long id) {
        log.debug("Calling getTranslationRequest: id={}", id);

        return webClient.get()
                .uri("/api/v1/translation-requests/{id}", id)
                .retrieve()
                .toEntity(TranslationRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OrderUpdatedResponse> updateTranslationRequest(Long id, UpdateTranslationRequest request) {
        log.debug("Calling updateTranslationRequest: id={}, status={}", id, request.status());

        return webClient.patch()
                .uri("/api/v1/translation-requests/{id}", id)
                .bodyValue(request)
                .retrieve()
                .toEntity(OrderUpdatedResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProjectUpdateResponse> addTranslationRequestUpdate(Long id, CreateProjectUpdateRequest request) {
        log.debug("Calling addTranslationRequestUpdate: id={}, updateType={}", id, request.updateType());

        return webClient.post()
                .uri("/api/v1/translation-requests/{id}/updates", id)
                .bodyValue(request)
                .retrieve()
                .toEntity(ProjectUpdateResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AccountResponse> getAccount() {
        return webClient.get()
                .uri("/api/v1/account")
                .retrieve()
                .toEntity(AccountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<UserResponse>> getAccountUsers() {
        return webClient.get()
                .uri("/api/v1/account/users")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<UserResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<UserResponse> getUser() {
        return webClient.get()
                .uri("/api/v1/user")
                .retrieve()
                .toEntity(UserResponse.class)
                .block();
    }
}
