package com.jobtailor.web.controller;

import com.jobtailor.common.dto.ApiResponse;
import com.jobtailor.common.dto.JobListing;
import com.jobtailor.common.dto.JobSearchRequest;
import com.jobtailor.common.dto.JobSearchResponse;
import com.jobtailor.jobs.service.JobSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 职位搜索接口。
 */
@RestController
@RequiredArgsConstructor
public class JobController {

    private final JobSearchService jobSearchService;

    @PostMapping("/scrape")
    public ApiResponse<JobSearchResponse> scrape(@Valid @RequestBody JobSearchRequest request) {
        List<JobListing> jobs = jobSearchService.search(request);
        return ApiResponse.ok(JobSearchResponse.of(jobs));
    }
}
