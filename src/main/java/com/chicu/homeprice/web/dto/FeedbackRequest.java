package com.chicu.homeprice.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    /** id из ответа /predict */
    @NotBlank
    private String id;

    @NotNull
    @PositiveOrZero
    @JsonProperty("real_price")
    private Double realPrice;
}
