package com.cw.contentflow.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 아카이브 결과. backend 는 실제로 저장을 처리한 백엔드 (REMOTE / LOCAL)
 */
@Data
@AllArgsConstructor
public class ArchiveReceipt {
    private String docUrl;
    private String backend;
}
