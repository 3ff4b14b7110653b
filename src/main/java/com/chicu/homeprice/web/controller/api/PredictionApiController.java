package com.chicu.homeprice.web.controller.api;

import com.chicu.homeprice.ml.predictionlog.PredictionLogService;
import com.chicu.homeprice.ml.predictionlog.PredictionNotFoundException;
import com.chicu.homeprice.ml.serving.PricePredictionService;
import com.chicu.homeprice.ml.serving.PredictionResult;
import com.chicu.homeprice.web.dto.ApiResponse;
import com.chicu.homeprice.web.dto.FeedbackRequest;
import com.chicu.homeprice.web.dto.PredictRequest;
import com.chicu.homeprice.web.dto.PredictResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class PredictionApiController {

    private final PricePredictionService predictionService;
    private final PredictionLogService predictionLog;

    @PostMapping(value = "/predict", produces = MediaType.APPLICATION_JSON_VALUE)
    public PredictResponse predict(@Valid @RequestBody PredictRequest req) {
        PredictionResult r = predictionService.predict(req.toFeatures());
        return new PredictResponse(r.id().toString(), r.predictedPrice(), r.runId());
    }

    @PostMapping(value = "/feedback", produces = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse feedback(@Valid @RequestBody FeedbackRequest req) {
        if (!predictionLog.updateRealPrice(req.getId(), req.getRealPrice())) {
            throw new PredictionNotFoundException(req.getId());
        }
        return ApiResponse.ok("real_price stored for " + req.getId());
    }
}
