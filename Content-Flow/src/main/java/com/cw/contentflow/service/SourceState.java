package com.cw.contentflow.service;

/**
 * 소스별 하트비트 단계. IDLE 에서만 새 사이클을 시작할 수 있다.
 */
public enum SourceState {
    IDLE,
    SCANNING,
    DEDUPING,
    FILTERING,
    ARCHIVING,
    REMEMBERING
}
