package com.example.loanmerge.exception;

/**
 * 输入文件损坏或不可读, 只影响当前单元
 */
public class PoolReadException extends RuntimeException {
    public PoolReadException(String message) {
        super(message);
    }

    public PoolReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
