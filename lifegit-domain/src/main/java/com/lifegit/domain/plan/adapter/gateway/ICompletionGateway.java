package com.lifegit.domain.plan.adapter.gateway;

import com.lifegit.domain.plan.model.valobj.CompletionRequest;

/**
 * 外部补全能力端口。
 */
public interface ICompletionGateway {

    /**
     * 执行一次补全。
     *
     * @param request 提示词与模型参数
     * @return 模型返回的原始文本
     * @throws com.lifegit.types.exception.AIServiceException 传输或服务端失败，携带失败分类
     */
    String complete(CompletionRequest request);
}
