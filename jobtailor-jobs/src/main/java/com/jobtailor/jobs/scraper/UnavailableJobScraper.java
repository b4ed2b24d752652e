package com.jobtailor.jobs.scraper;

import com.jobtailor.common.dto.JobListing;
import com.jobtailor.common.dto.JobSearchRequest;
import com.jobtailor.common.exception.JobScrapingException;

import java.util.List;

/**
 * 未接入抓取后端时的占位实现。
 */
public class UnavailableJobScraper implements JobScraper {

    @Override
    public List<JobListing> scrape(JobSearchRequest request) {
        throw new JobScrapingException("职位抓取服务未接入");
    }
}
