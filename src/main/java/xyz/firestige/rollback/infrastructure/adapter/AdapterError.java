package xyz.firestige.rollback.infrastructure.adapter;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * 适配器错误
 * <p>
 * retryable=true 的错误由驱动器按重试策略重试；false 直接终止该目标
 *
 * @param target    目标名称
 * @param reason    失败原因
 * @param retryable 是否可重试
 * @param errorType 错误分类
 */
public record AdapterError(String target, String reason, boolean retryable, ErrorType errorType) {

    public static AdapterError retryable(String target, String reason, ErrorType errorType) {
        return new AdapterError(target, reason, true, errorType);
    }

    public static AdapterError fatal(String target, String reason, ErrorType errorType) {
        return new AdapterError(target, reason, false, errorType);
    }

    /**
     * 按异常类型分类
     * <p>
     * 网络不可达、超时、5xx、数据库连接故障视为瞬时错误；4xx、参数错误和其他异常视为不可重试
     */
    public static AdapterError fromException(String target, String action, Exception e) {
        String detail = action + " 失败: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        if (e instanceof ResourceAccessException || e instanceof IOException) {
            return retryable(target, detail, ErrorType.NETWORK_ERROR);
        }
        if (e instanceof TimeoutException || e instanceof QueryTimeoutException) {
            return retryable(target, detail, ErrorType.TIMEOUT_ERROR);
        }
        if (e instanceof HttpServerErrorException || e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException) {
            return retryable(target, detail, ErrorType.SERVICE_UNAVAILABLE);
        }
        if (e instanceof HttpClientErrorException) {
            return fatal(target, detail, ErrorType.BUSINESS_ERROR);
        }
        if (e instanceof IllegalArgumentException) {
            return fatal(target, detail, ErrorType.VALIDATION_ERROR);
        }
        return fatal(target, detail, ErrorType.SYSTEM_ERROR);
    }

    public FailureInfo toFailureInfo(String failedAt) {
        return new FailureInfo(errorType.name(), reason, errorType, failedAt, retryable);
    }
}
