package com.jobtailor.jobs.service;

import com.jobtailor.common.dto.JobListing;
import com.jobtailor.common.dto.JobSearchRequest;
import com.jobtailor.common.exception.JobScrapingException;
import com.jobtailor.jobs.scraper.JobScraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 职位搜索：调用抓取后端，并按经验级别过滤描述。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSearchService {

    private final JobScraper jobScraper;

    public List<JobListing> search(JobSearchRequest request) {
        log.info("抓取职位: {} @ {}, 站点: {}", request.getSearchTerm(), request.getLocation(), request.getSites());

        List<JobListing> jobs;
        try {
            jobs = jobScraper.scrape(request);
        } catch (JobScrapingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JobScrapingException("职位抓取失败: " + e.getMessage(), e);
        }

        if (jobs == null || jobs.isEmpty()) {
            log.warn("未找到职位");
            return List.of();
        }

        String level = request.getExperienceLevel();
        if (level != null && !level.isBlank()) {
            log.info("按经验级别筛选: {}", level);
            Pattern pattern = experiencePattern(level.trim());
            jobs = jobs.stream()
                    .filter(job -> job.getDescription() != null && pattern.matcher(job.getDescription()).find())
                    .collect(Collectors.toList());
        }

        log.info("共找到 {} 个职位", jobs.size());
        return jobs;
    }

    /**
     * 描述中出现该级别、"0-3 years" 或 "entry level" 任一即视为匹配。
     */
    static Pattern experiencePattern(String level) {
        return Pattern.compile(Pattern.quote(level) + "|0-3 years|entry level", Pattern.CASE_INSENSITIVE);
    }
}
