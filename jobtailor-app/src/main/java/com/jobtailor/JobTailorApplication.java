package com.jobtailor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * JobTailor 简历定制服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.jobtailor")
public class JobTailorApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobTailorApplication.class, args);
    }
}
