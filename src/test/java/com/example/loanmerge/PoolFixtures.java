package com.example.loanmerge;

import com.example.loanmerge.config.AppProperties;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * 测试用的输入文件和配置
 */
public class PoolFixtures {

    public static final String ECB_POOL = "RMBMIT000001100120081";
    public static final String ESMA_POOL = "RMBMIT000001100120081";

    public static final String TEMPLATE_CSV =
            "FIELD CODE,FIELD NAME,For info: existing ECB or EBA NPL template field code\n" +
            "RREL3,Underlying Exposure Identifier,AR3\n" +
            "RREL6,Data Cut-Off Date,AR1\n" +
            "RREL30,Current Principal Balance,AR20\n" +
            "RREL81,Lender Country,\n";

    // ECB: 列名需要映射; AR129 没有映射, 原样保留
    public static final String ECB_CONTENT =
            "AR1,AR3,AR20,AR129\n" +
            "2020-03-31,L1,100,ITC4\n" +
            "2020-03-31,L2,200,ITC4\n" +
            "2020-06-30,L1,110,ITC4\n";

    public static final String ESMA_CONTENT =
            "RREL3,RREL6,RREL30,RREL81\n" +
            "L1,2020-03-31,101,IT\n" +
            "L3,2020-03-31,300,IT\n";

    public static final String CORRESPONDENCE_JSON =
            "{\"pools\": {\"" + ECB_POOL + "\": {\"esma_pool\": \"" + ESMA_POOL + "\"}}, \"overlap_pools\": []}";

    /**
     * 所有目录都在 root 下, 缓冲区和分块都设得很小, 让分块逻辑在小文件上也会生效
     */
    public static AppProperties properties(Path root) {
        AppProperties config = new AppProperties();
        config.getSource().setEcbDir(root.resolve("ecb").toString());
        config.getSource().setEsmaDir(root.resolve("esma").toString());
        config.getMapping().setTemplatePath(root.resolve("template.csv").toString());
        config.getPool().setCorrespondencePath(root.resolve("pool_mapping.json").toString());
        config.getOutput().setPoolDir(root.resolve("out/pools").toString());
        config.getOutput().setCountryDir(root.resolve("out/countries").toString());
        config.getPerformance().setReadBufferSize(8 * 1024);
        config.getPerformance().setWriteBufferSize(8 * 1024);
        config.getPerformance().setChunkRows(2);
        return config;
    }

    public static Path writeText(Path file, String content) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    public static Path writeGzip(Path file, String content) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return file;
    }

    /**
     * 一个 matched pool 的完整输入: 模板, 对应关系, ECB .gz, ESMA .csv
     */
    public static void writeMatchedPool(Path root) throws IOException {
        writeText(root.resolve("template.csv"), TEMPLATE_CSV);
        writeText(root.resolve("pool_mapping.json"), CORRESPONDENCE_JSON);
        writeGzip(root.resolve("ecb").resolve(ECB_POOL + "_20200331.gz"), ECB_CONTENT);
        writeText(root.resolve("esma").resolve("ESMA_" + ESMA_POOL + "_2020_01.csv"), ESMA_CONTENT);
    }

    public static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
