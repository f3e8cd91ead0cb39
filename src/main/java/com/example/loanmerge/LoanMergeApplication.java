package com.example.loanmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoanMergeApplication {

    public static void main(String[] args) {
        // 批处理程序: PipelineRunner 跑完所有阶段后进程退出
        System.exit(SpringApplication.exit(SpringApplication.run(LoanMergeApplication.class, args)));
    }
}
