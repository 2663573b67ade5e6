/**
 * Plan 领域 - 任务计划
 *
 * <p>职责：AI 计划生成（经失败策略重试与兜底）、计划校验与装配、进度计算、计划编辑。</p>
 *
 * <h3>端口</h3>
 * <ul>
 *   <li>{@link com.lifegit.domain.plan.adapter.gateway.ITaskPlanGenerator} - 一次补全生成一个计划</li>
 *   <li>{@link com.lifegit.domain.plan.adapter.gateway.ICompletionGateway} - 外部补全能力</li>
 *   <li>{@link com.lifegit.domain.plan.adapter.gateway.IBackoffScheduler} - 非阻塞退避</li>
 * </ul>
 *
 * @author lifegit
 * @since 2025-01-30
 */
package com.lifegit.domain.plan;
