/**
 * Branch 领域 - 目标分支生命周期
 *
 * <p>职责：目标分支的创建、完成、废弃、重新激活、合并到主线与删除。</p>
 *
 * <h3>状态机</h3>
 * <ul>
 *   <li>创建 → ACTIVE</li>
 *   <li>ACTIVE → COMPLETED（追加里程碑提交）</li>
 *   <li>ACTIVE → ABANDONED → ACTIVE</li>
 *   <li>COMPLETED → 已合并（主线追加里程碑提交，终态）</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.lifegit.domain.branch.model.entity.BranchEntity}</li>
 * </ul>
 *
 * @author lifegit
 * @since 2025-01-30
 */
package com.lifegit.domain.branch;
