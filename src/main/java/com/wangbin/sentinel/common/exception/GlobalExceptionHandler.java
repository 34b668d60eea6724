package com.wangbin.sentinel.common.exception;

import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理检查配置异常
     */
    @ExceptionHandler(CheckConfigException.class)
    public ApiResult<?> handleCheckConfigException(CheckConfigException e) {
        log.error("检查配置异常 - Check: {}, {}", e.getCheckName(), e.getMessage());
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("checkName", e.getCheckName());
        return result;
    }

    /**
     * 处理数据源异常
     */
    @ExceptionHandler(SampleSourceException.class)
    public ApiResult<?> handleSampleSourceException(SampleSourceException e) {
        log.error("数据源异常 - Source: {}, Series: {}", e.getSourceName(), e.getSeries(), e);
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("source", e.getSourceName());
        result.addExtra("series", e.getSeries());
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理请求体解析异常
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResult<?> handleNotReadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("请求体无法解析: {} {}", request.getMethod(), request.getRequestURI());
        return ApiResult.error(ResultCode.BAD_REQUEST.getCode(), "Invalid JSON: " + e.getMostSpecificCause().getMessage());
    }

    /**
     * 处理参数校验异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ApiResult<?> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        String message = fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.error("参数校验异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理约束违反异常
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ApiResult<?> handleConstraintViolationException(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));

        log.error("约束违反异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ApiResult<?> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("非法参数: {}", e.getMessage());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), e.getMessage());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);

        String message = ResultCode.SYSTEM_ERROR.getMessage();
        if (isDevEnvironment()) {
            message = e.getMessage();
        }
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), message);
    }

    private boolean isDevEnvironment() {
        String activeProfile = System.getProperty("spring.profiles.active");
        return "dev".equals(activeProfile) || "test".equals(activeProfile);
    }
}
