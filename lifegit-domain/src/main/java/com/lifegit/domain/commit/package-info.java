/**
 * Commit 领域 - 提交账本，按分支只追加。
 *
 * @author lifegit
 * @since 2025-01-30
 */
package com.lifegit.domain.commit;
