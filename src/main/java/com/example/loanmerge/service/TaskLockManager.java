package com.example.loanmerge.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 处理单元 (pool 或国家) 的独占锁, key 是单元 id (输出文件相对路径)
 */
@Component
public class TaskLockManager {

    // 线程安全的 Set
    private final Set<String> runningUnits = ConcurrentHashMap.newKeySet();

    /**
     * 尝试锁定单元
     * @return true 如果锁定成功, false 如果该单元已经有 worker 在处理
     */
    public boolean tryLock(String unit) {
        return runningUnits.add(unit);
    }

    public void releaseLock(String unit) {
        runningUnits.remove(unit);
    }
}
