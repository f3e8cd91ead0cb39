package com.example.loanmerge.service;

import com.example.loanmerge.dto.CheckpointEntry;
import com.example.loanmerge.enums.MergeStage;
import com.example.loanmerge.util.OutputDirectoryUtil;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 某个阶段的完成登记簿 (每次运行构造一个, 传给需要它的组件)
 *
 * <p>单元 id 是输出文件相对阶段输出目录的路径; 正式文件存在即视为完成,
 * 登记簿和磁盘冲突时以磁盘为准. 所有方法同步, 多个 worker 线程可以并发调用.
 */
@Slf4j
public class CheckpointManager {

    private static final String STATE_DONE = "DONE";
    private static final Type ENTRY_LIST_TYPE = new TypeToken<List<CheckpointEntry>>() { }.getType();

    private final MergeStage stage;
    private final Path outputDir;
    private final Path registryFile;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Map<String, CheckpointEntry> entries = new TreeMap<>();

    private CheckpointManager(MergeStage stage, Path outputDir) {
        this.stage = stage;
        this.outputDir = outputDir;
        this.registryFile = outputDir.resolve("_checkpoint_" + stage.name().toLowerCase() + ".json");
    }

    /**
     * 打开 (或新建) 登记簿并与磁盘状态对账
     */
    public static CheckpointManager open(MergeStage stage, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建输出目录: " + outputDir, e);
        }
        CheckpointManager manager = new CheckpointManager(stage, outputDir);
        manager.load();
        manager.reconcile();
        return manager;
    }

    private void load() {
        if (!Files.isRegularFile(registryFile)) {
            return;
        }
        try (Reader reader = Files.newBufferedReader(registryFile, StandardCharsets.UTF_8)) {
            List<CheckpointEntry> list = gson.fromJson(reader, ENTRY_LIST_TYPE);
            if (list != null) {
                for (CheckpointEntry entry : list) {
                    entries.put(entry.getUnit(), entry);
                }
            }
        } catch (IOException | JsonParseException e) {
            // 登记簿只是磁盘状态的缓存, 坏了就从磁盘重建
            log.warn("checkpoint 文件无法读取, 将根据输出目录重建: {} ({})", registryFile, e.getMessage());
            entries.clear();
        }
    }

    /**
     * 启动时对账:
     * 1. 登记了但正式文件不存在 -> 删除登记
     * 2. 正式文件存在但没登记 -> 补登记
     * 3. 删除所有残留的临时文件, 对应单元会从头重做
     */
    public synchronized void reconcile() {
        int dropped = 0;
        for (String unit : new ArrayList<>(entries.keySet())) {
            if (!Files.isRegularFile(finalPath(unit))) {
                entries.remove(unit);
                dropped++;
                log.warn("checkpoint 登记的输出文件不存在, 单元将重新处理: {}", unit);
            }
        }

        int recovered = 0;
        int tempDeleted = 0;
        for (Path file : listOutputFiles()) {
            String name = file.getFileName().toString();
            if (name.endsWith(OutputDirectoryUtil.TEMP_SUFFIX)) {
                try {
                    Files.deleteIfExists(file);
                    tempDeleted++;
                    log.warn("清理上次中断遗留的临时文件: {}", file);
                } catch (IOException e) {
                    throw new UncheckedIOException("无法删除临时文件: " + file, e);
                }
            } else if (OutputDirectoryUtil.isFinalCsv(file)) {
                String unit = unitOf(file);
                if (!entries.containsKey(unit)) {
                    entries.put(unit, new CheckpointEntry(unit, stage.name(), STATE_DONE, now(), -1));
                    recovered++;
                }
            }
        }
        persist();
        log.info("checkpoint[{}] 对账完成: 已完成 {}, 补登记 {}, 失效登记 {}, 清理临时文件 {}",
                stage, entries.size(), recovered, dropped, tempDeleted);
    }

    public synchronized boolean isDone(String unit) {
        if (!entries.containsKey(unit)) {
            return Files.isRegularFile(finalPath(unit)) && recover(unit);
        }
        if (!Files.isRegularFile(finalPath(unit))) {
            entries.remove(unit);
            persist();
            return false;
        }
        return true;
    }

    private boolean recover(String unit) {
        entries.put(unit, new CheckpointEntry(unit, stage.name(), STATE_DONE, now(), -1));
        persist();
        return true;
    }

    /**
     * 只有在正式文件已经 rename 落盘后才能调用
     */
    public synchronized void markDone(String unit, long rows) {
        if (!Files.isRegularFile(finalPath(unit))) {
            throw new IllegalStateException("输出文件还不存在, 不能登记完成: " + finalPath(unit));
        }
        entries.put(unit, new CheckpointEntry(unit, stage.name(), STATE_DONE, now(), rows));
        persist();
    }

    /**
     * 删除单元的临时文件
     * @return 是否真的删除了文件
     */
    public synchronized boolean cleanupTemp(String unit) {
        Path temp = tempPath(unit);
        try {
            boolean deleted = Files.deleteIfExists(temp);
            if (deleted) {
                log.info("已清理临时文件: {}", temp);
            }
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("无法删除临时文件: " + temp, e);
        }
    }

    synchronized List<CheckpointEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public Path finalPath(String unit) {
        return outputDir.resolve(unit);
    }

    public Path tempPath(String unit) {
        return OutputDirectoryUtil.tempPathOf(finalPath(unit));
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public MergeStage getStage() {
        return stage;
    }

    private String unitOf(Path file) {
        return outputDir.relativize(file).toString().replace('\\', '/');
    }

    private List<Path> listOutputFiles() {
        // pool 阶段输出在子目录, 国家阶段直接在输出目录下
        try (Stream<Path> files = Files.walk(outputDir, 2)) {
            return files.filter(Files::isRegularFile)
                    .filter(f -> !f.getFileName().toString().startsWith("_"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("无法扫描输出目录: " + outputDir, e);
        }
    }

    private void persist() {
        Path temp = registryFile.resolveSibling(registryFile.getFileName() + OutputDirectoryUtil.TEMP_SUFFIX);
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(new ArrayList<>(entries.values()), ENTRY_LIST_TYPE, writer);
            }
            try {
                Files.move(temp, registryFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, registryFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("无法写入 checkpoint 文件: " + registryFile, e);
        }
    }

    private static String now() {
        return LocalDateTime.now().toString();
    }
}
