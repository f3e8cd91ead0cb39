package com.example.loanmerge.config;

import com.univocity.parsers.csv.CsvFormat;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriterSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "app") // 对应 application.yml 中的 app:
public class AppProperties {

    /**
     * 要执行的阶段, 按顺序执行 (POOL 必须在 COUNTRY 之前)
     */
    private List<String> stages = new ArrayList<>(List.of("POOL", "COUNTRY"));

    private Csv csv = new Csv();

    private Source source = new Source();

    private Mapping mapping = new Mapping();

    private Pool pool = new Pool();

    private Country country = new Country();

    private Output output = new Output();

    private Performance performance = new Performance();

    private ThreadPools threadPool = new ThreadPools();

    @Data
    public static class Csv {
        // ECB 原始文件 (gzip)
        private CsvDetailConfig ecbSource = new CsvDetailConfig();

        // ESMA 合并后的文件
        private CsvDetailConfig esmaSource = new CsvDetailConfig();

        // 本程序输出的 pool 级 / 国家级文件
        private CsvDetailConfig output = new CsvDetailConfig();
    }

    /**
     * 复用具体的 CSV 细节配置类
     * 包含 encoding, delimiter 以及生成 Settings 的工厂方法
     */
    @Data
    public static class CsvDetailConfig {
        private String encoding = "UTF-8";

        private char delimiter = ',';

        private char quote = '"';

        private char quoteEscape = '"';

        /**
         * 换行符配置
         * 可选值: "\n", "\r\n", 或者 "AUTO" (自动检测)
         */
        private String lineSeparator = "AUTO";

        // 单个单元格最大字符数, 监管数据里有很长的描述字段
        private int maxCharsPerColumn = 100_000;

        private int maxColumns = 2048;

        // 是否所有字段都加引号 (写出时)
        private boolean quoteAllFields = false;

        public CsvParserSettings toParserSettings() {
            CsvParserSettings settings = new CsvParserSettings();

            CsvFormat format = settings.getFormat();
            format.setDelimiter(this.delimiter);
            format.setQuote(this.quote);
            format.setQuoteEscape(this.quoteEscape);
            // 监管数据里没有注释行, 用一个不会出现的字符关闭注释识别
            format.setComment('\0');
            if ("AUTO".equalsIgnoreCase(this.lineSeparator) || this.lineSeparator == null) {
                settings.setLineSeparatorDetectionEnabled(true);
            } else {
                format.setLineSeparator(this.lineSeparator);
            }
            // 表头由程序自己读取 (第一行), 不让 univocity 抽取
            settings.setHeaderExtractionEnabled(false);
            settings.setMaxCharsPerColumn(this.maxCharsPerColumn);
            settings.setMaxColumns(this.maxColumns);
            // 所有值都是不透明文本, 不做 trim
            settings.setIgnoreLeadingWhitespaces(false);
            settings.setIgnoreTrailingWhitespaces(false);
            settings.setSkipEmptyLines(true);
            settings.setReadInputOnSeparateThread(false);
            return settings;
        }

        public CsvWriterSettings toWriterSettings() {
            CsvWriterSettings settings = new CsvWriterSettings();
            CsvFormat format = settings.getFormat();
            format.setDelimiter(this.delimiter);
            format.setQuote(this.quote);
            format.setQuoteEscape(this.quoteEscape);
            // 写出时明确指定换行符，不要用 AUTO
            String separator = "AUTO".equalsIgnoreCase(this.lineSeparator) ? "\n" : this.lineSeparator;
            format.setLineSeparator(separator);
            settings.setMaxCharsPerColumn(this.maxCharsPerColumn);
            settings.setMaxColumns(this.maxColumns);
            settings.setIgnoreLeadingWhitespaces(false);
            settings.setIgnoreTrailingWhitespaces(false);
            settings.setSkipEmptyLines(false);
            settings.setQuoteAllFields(this.quoteAllFields);
            return settings;
        }
    }

    @Data
    public static class Source {
        // ECB 文件目录 (*.gz)
        private String ecbDir;
        // ESMA 文件目录 (*.csv)
        private String esmaDir;
    }

    @Data
    public static class Mapping {
        // ESMA 模板 (xlsx 或 csv)
        private String templatePath;
        // xlsx 时使用的 sheet, 为空取第一个
        private String sheet = "";
        private String esmaCodeColumn = "FIELD CODE";
        private String esmaNameColumn = "FIELD NAME";
        private String ecbCodeColumn = "For info: existing ECB or EBA NPL template field code";
        // 可选的显式优先标记列
        private String preferredColumn = "PREFERRED";
        // 名称里含有该标记的行视为 "新版" 优先
        private String preferredMarker = "New";
    }

    @Data
    public static class Pool {
        // ECB <-> ESMA pool 对应关系 (json)
        private String correspondencePath;
        // 额外的重叠 pool (与 json 里的 overlap_pools 合并)
        private List<String> overlapPools = new ArrayList<>();
        private String loanIdColumn = "RREL3";
        private String cutoffDateColumn = "RREL6";
        private String fallbackDateColumn = "AR1";
        private String sourceColumn = "source";
        private String ecbPoolIdColumn = "ecb_pool_id";
        private String esmaPoolIdColumn = "esma_pool_id";
        // 只输出至少有一个非空值的列
        private boolean dropEmptyColumns = true;
    }

    @Data
    public static class Country {
        // 识别国家时读取的样本行数
        private int sampleRows = 100;
        // 统一 schema 后缺失列填充的值
        private String nullMarker = "";
    }

    @Data
    public static class Output {
        // pool 级输出根目录 (matched / ecb_only / esma_only)
        private String poolDir;
        // 国家级输出目录
        private String countryDir;
        // 运行汇总文件名 (位于 poolDir 下)
        private String summaryFile = "_run_summary.json";
    }

    @Data
    public static class Performance {
        // 读缓冲区 (字节)，默认 8MB
        private int readBufferSize = 8 * 1024 * 1024;
        // 写缓冲区 (字节)，默认 1MB
        private int writeBufferSize = 1024 * 1024;
        // 分块处理的行数
        private int chunkRows = 100_000;
        // 压缩后大小超过该值的 pool 走分块模式, 默认 100MB
        private long largePoolThresholdBytes = 100L * 1024 * 1024;
    }

    @Data
    public static class ThreadPools {
        private ThreadPool poolMerge = new ThreadPool();
        private ThreadPool countryMerge = new ThreadPool();
    }

    @Data
    public static class ThreadPool {
        private int corePoolSize = 2;
        private int maxPoolSize = 2;
        private int queueCapacity = 10_000;
    }

}
