package com.lifegit.infrastructure.repository;

import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * 仓储调用包装：数据访问异常统一转换为 REPOSITORY_ERROR。
 */
@Slf4j
public final class RepositoryErrors {

    private RepositoryErrors() {
    }

    public static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            log.warn("REPOSITORY_ERROR operation={}, errorType={}, reason={}",
                    operation, ex.getClass().getSimpleName(), ex.getMessage());
            throw new AppException(ResponseCode.REPOSITORY_ERROR.getCode(),
                    ResponseCode.REPOSITORY_ERROR.getInfo() + ": " + operation, ex);
        }
    }
}
