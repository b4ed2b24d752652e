package com.jobtailor.common.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 职位搜索结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobSearchResponse {

    private List<JobListing> jobs;

    private int count;

    public static JobSearchResponse of(List<JobListing> jobs) {
        return new JobSearchResponse(jobs, jobs.size());
    }
}
