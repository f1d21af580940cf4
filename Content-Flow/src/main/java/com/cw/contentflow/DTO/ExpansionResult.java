package com.cw.contentflow.DTO;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 확인 이벤트 처리 결과.
 * ACCEPTED 라도 플랫폼 일부가 실패했을 수 있으니 results 를 항목별로 봐야 한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExpansionResult {

    public enum Status { HANDSHAKE, IGNORED, REJECTED, ACCEPTED }

    private Status status;
    private String reason;
    private String challenge;
    private String topicTraceId;
    private int generatedCount;
    @Builder.Default
    private List<PlatformResult> results = new ArrayList<>();

    public static ExpansionResult handshake(String challenge) {
        return ExpansionResult.builder().status(Status.HANDSHAKE).challenge(challenge == null ? "" : challenge).build();
    }

    public static ExpansionResult ignored(String reason) {
        return ExpansionResult.builder().status(Status.IGNORED).reason(reason).build();
    }

    public static ExpansionResult rejected(String reason) {
        return ExpansionResult.builder().status(Status.REJECTED).reason(reason).build();
    }
}
