package com.example.loanmerge.exception;

/**
 * 输出目录不可写或落盘失败, 当前单元的临时文件会被删除, 单元保持未完成状态
 */
public class OutputWriteException extends RuntimeException {
    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
