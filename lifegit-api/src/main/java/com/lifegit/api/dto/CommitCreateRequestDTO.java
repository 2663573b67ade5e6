package com.lifegit.api.dto;

import lombok.Data;

/**
 * 手动提交请求 DTO。
 */
@Data
public class CommitCreateRequestDTO {

    private String message;

    /**
     * 提交类型编码，如 learning、reflection
     */
    private String type;

    private Long relatedTaskId;
}
