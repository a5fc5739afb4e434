package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.EstimateApi;
import com.nosota.lingodesk.api.request.EstimateRequest;
import com.nosota.lingodesk.api.response.EstimateResponse;
import com.nosota.lingodesk.service.CostEstimator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
public class EstimateController implements EstimateApi {

    private final CostEstimator costEstimator;

    @Override
    public ResponseEntity<EstimateResponse> estimate(EstimateRequest request) {
        return ResponseEntity.ok(costEstimator.estimate(
                request.characterCount(), request.targetLanguages().size(), request.workflow()));
    }
}
