package com.tradedesk.invoicer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class ApiErrorResponse {
    private int status;
    private String error;
    private String code;
    private String message;
    private Map<String, Object> details;
    private Instant timestamp;
    private String path;
}
