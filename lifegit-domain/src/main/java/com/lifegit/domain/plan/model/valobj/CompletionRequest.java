package com.lifegit.domain.plan.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次补全请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {

    private String systemPrompt;

    private String userPrompt;

    private String model;

    private Double temperature;

    private Integer maxTokens;
}
