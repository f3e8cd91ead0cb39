package com.example.loanmerge.service;

import com.example.loanmerge.dto.RunSummary;
import com.example.loanmerge.exception.OutputWriteException;
import com.example.loanmerge.util.OutputDirectoryUtil;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Component
@Slf4j
public class RunSummaryWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public void write(RunSummary summary, Path file) {
        Path temp = OutputDirectoryUtil.tempPathOf(file);
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(summary, writer);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("运行汇总已写入: {}", file);
        } catch (IOException e) {
            throw new OutputWriteException("无法写入运行汇总: " + file, e);
        }
    }
}
