package com.opsos.itemresolution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MapInvoiceLineRequest {

    @NotNull
    @JsonProperty("item_id")
    private Long itemId;
}
