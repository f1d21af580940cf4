package com.cw.contentflow.service;

import lombok.Getter;

/**
 * 워커(피드/생성/이미지/문서저장소) 호출 실패.
 * transientFailure=true 는 연결 오류·타임아웃·5xx 로 재시도 대상.
 */
@Getter
public class WorkerCallException extends RuntimeException {
    private final String worker;
    private final boolean transientFailure;
    private final int statusCode; // HTTP 응답이 없으면 0

    public WorkerCallException(String worker, boolean transientFailure, int statusCode, String message, Throwable cause) {
        super("[" + worker + "] " + message, cause);
        this.worker = worker;
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public WorkerCallException(String worker, String message) {
        this(worker, false, 0, message, null);
    }
}
