package com.cw.contentflow.service;

/**
 * rules 문서를 읽을 수 없거나 내용이 잘못됨 (주기/시각 형식, 소스 id 등)
 */
public class RulesException extends RuntimeException {
    public RulesException(String message) {
        super(message);
    }

    public RulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
