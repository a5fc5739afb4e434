package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.request.EstimateRequest;
import com.nosota.lingodesk.api.response.EstimateResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Cost estimation. Uses the same formula the server applies when an order is submitted.
 */
@RequestMapping("/api/estimates")
public interface EstimateApi {

    @PostMapping
    ResponseEntity<EstimateResponse> estimate(@RequestBody @Valid EstimateRequest request);
}
