package com.cw.contentflow.service;

import com.cw.contentflow.entity.ContentPackage;

/**
 * 아카이브 저장소 1개. 성공하면 문서 URL, 실패하면 예외.
 * 체인 순서는 @Order 로 정한다.
 */
public interface ArchiveBackend {

    String name();

    boolean isEnabled();

    String write(ContentPackage pack);
}
