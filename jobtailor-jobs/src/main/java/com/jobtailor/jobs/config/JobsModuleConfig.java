package com.jobtailor.jobs.config;

import com.jobtailor.jobs.scraper.JobScraper;
import com.jobtailor.jobs.scraper.UnavailableJobScraper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 职位模块自动配置。
 * <p>
 * 抓取后端由外部提供 {@link JobScraper} Bean 接入；未接入时使用占位实现，
 * 搜索接口返回“服务不可用”，其余功能不受影响。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.jobtailor.jobs")
public class JobsModuleConfig {

    @Bean
    @ConditionalOnMissingBean(JobScraper.class)
    public JobScraper unavailableJobScraper() {
        log.warn("未接入职位抓取后端，/scrape 接口将返回不可用");
        return new UnavailableJobScraper();
    }
}
