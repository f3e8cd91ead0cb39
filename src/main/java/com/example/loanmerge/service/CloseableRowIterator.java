package com.example.loanmerge.service;

import java.util.Iterator;
import java.util.List;

/**
 * 通用行数据迭代器, 第一行作为表头
 */
public interface CloseableRowIterator extends Iterator<String[]>, AutoCloseable {

    String[] getHeader();

    /**
     * 最多读取 maxRows 行, 到文件末尾时返回空列表
     */
    List<String[]> nextBatch(int maxRows);

    @Override
    void close();
}
