package com.work.chainexec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口提交交易、私有交易，并查看跨链编排状态。
 */
@SpringBootApplication
public class ChainExecApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainExecApplication.class, args);
    }
}
