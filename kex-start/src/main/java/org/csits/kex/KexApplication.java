package org.csits.kex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类，以常驻服务方式提供导出接口。
 *
 * 示例：
 *  java -jar kex-start.jar --spring.profiles.active=memory
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.kex")
public class KexApplication {

    public static void main(String[] args) {
        SpringApplication.run(KexApplication.class, args);
        log.info("导出服务已启动");
    }
}
