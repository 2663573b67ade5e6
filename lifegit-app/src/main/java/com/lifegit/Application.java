package com.lifegit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * LifeGit 应用启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到所有子模块中的组件。
 * </p>
 *
 * @author lifegit
 * @since 2025-01-29
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
