package com.cw.contentflow.DTO;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 초안 확장 매니페스트의 플랫폼별 항목
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlatformResult {

    public enum Status { SUCCEEDED, FAILED, SKIPPED_EXISTING, SKIPPED_IN_FLIGHT }

    private String platform;
    private String traceId;
    private Status status;
    private String docUrl;
    private String backend;
    private String error;
}
