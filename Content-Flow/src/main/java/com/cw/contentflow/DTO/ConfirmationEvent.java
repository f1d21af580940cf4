package com.cw.contentflow.DTO;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 콜백 페이로드를 별칭 정규화한 결과
 */
@Value
@Builder
public class ConfirmationEvent {
    String status;
    String title;
    String summary;
    String sourceUrl;
    String sourceInfo;
    String topicTraceId;
    List<String> channels;
}
