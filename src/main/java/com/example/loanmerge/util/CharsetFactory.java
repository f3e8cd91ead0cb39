package com.example.loanmerge.util;

import com.ibm.icu.charset.CharsetICU;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.Charset;

@Slf4j
public class CharsetFactory {

    /**
     * 尝试加载字符集，优先 JDK 原生，降级使用 ICU
     */
    public static Charset resolveCharset(String name) {
        // 1. 尝试标准 JDK 加载
        try {
            return Charset.forName(name);
        } catch (Exception e) {
            log.debug("JDK原生不支持 {}, 尝试使用 ICU4J...", name);
        }

        // 2. 尝试 ICU4J 加载
        try {
            return CharsetICU.forNameICU(name);
        } catch (Exception e) {
            log.error("致命错误: 无法识别的字符集编码 [{}]", name);
            throw new IllegalStateException("不支持的字符集: " + name, e);
        }
    }
}
