package com.work.anchor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口：启动时连接链并缓存 chainId，之后由调用方通过 AnchorEngine 提交锚定。
 */
@SpringBootApplication
public class AnchorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnchorApplication.class, args);
    }
}
