package com.jobtailor.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 抓取到的单条职位信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobListing {

    /** 来源站点: indeed / linkedin / zip_recruiter ... */
    private String site;

    private String title;
    private String company;
    private String location;
    private String jobUrl;
    private String description;
    private LocalDate datePosted;
    private Boolean isRemote;
    private String jobType;

    /** 薪资区间 */
    private Double minAmount;
    private Double maxAmount;
    private String currency;
    private String interval;
}
