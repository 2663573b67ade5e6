package com.lifegit.api.dto;

import lombok.Data;

/**
 * 新增或修改任务项请求 DTO。修改时为空的字段保持原值。
 */
@Data
public class TaskItemRequestDTO {

    private String title;
    private String description;
    private Integer estimatedDuration;

    /**
     * daily / weekly / monthly
     */
    private String timeScope;

    private String executionTips;
}
