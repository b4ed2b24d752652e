package com.jobtailor.jobs.scraper;

import com.jobtailor.common.dto.JobListing;
import com.jobtailor.common.dto.JobSearchRequest;

import java.util.List;

/**
 * 职位抓取后端接口（Indeed、LinkedIn、ZipRecruiter 等招聘站点）。
 */
public interface JobScraper {

    /**
     * 按搜索条件抓取职位，不做经验级别筛选。
     *
     * @throws com.jobtailor.common.exception.JobScrapingException 抓取失败
     */
    List<JobListing> scrape(JobSearchRequest request);
}
