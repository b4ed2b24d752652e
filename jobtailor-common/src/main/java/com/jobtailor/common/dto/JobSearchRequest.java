package com.jobtailor.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 职位搜索参数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobSearchRequest {

    @NotEmpty
    @Builder.Default
    private List<String> sites = new ArrayList<>(List.of("indeed", "linkedin", "zip_recruiter"));

    @Builder.Default
    private String searchTerm = "developer";

    @Builder.Default
    private String location = "Remote";

    @Min(1)
    @Max(1000)
    @Builder.Default
    private int resultsWanted = 20;

    @Min(1)
    @Builder.Default
    private int hoursOld = 72;

    /** 仅远程职位 */
    @JsonProperty("is_remote")
    @Builder.Default
    private boolean remote = true;

    @Builder.Default
    private String countryIndeed = "USA";

    /** 经验级别筛选（entry / mid / senior），为空不筛选 */
    private String experienceLevel;
}
