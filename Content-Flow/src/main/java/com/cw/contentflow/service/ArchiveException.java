package com.cw.contentflow.service;

/**
 * 아카이브 백엔드 전부 실패
 */
public class ArchiveException extends RuntimeException {
    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
