package com.example.loanmerge.dto;

import lombok.Value;

import java.nio.file.Path;

/**
 * 一个参与国家级合并的 pool 级文件
 */
@Value
public class CountryFile {
    Path path;
    String poolId;
    // matched / ecb_only / esma_only
    String folder;
    String country;
    long sizeBytes;
}
