package com.lifegit.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 创建目标请求 DTO。
 */
@Data
public class BranchCreateRequestDTO {

    private String name;
    private String description;

    /**
     * 期望完成时间的自然语言描述，如 "3个月内"，可空
     */
    private String timeframe;

    private LocalDate expectedCompletionDate;
}
