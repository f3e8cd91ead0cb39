package com.example.loanmerge.exception;

/**
 * 映射模板无法读取或结构不对 (缺少必需的列)
 * 属于整个阶段的致命错误, 在处理任何 pool 之前抛出
 */
public class MappingLoadException extends RuntimeException {
    public MappingLoadException(String message) {
        super(message);
    }

    public MappingLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
