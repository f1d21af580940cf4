package com.cw.contentflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * contentflow.* 설정 바인딩
 * application.yml 에서 환경변수(${RULES_PATH:...} 등)로 덮어쓸 수 있음
 */
@Data
@ConfigurationProperties(prefix = "contentflow")
public class ContentFlowProperties {

    /** rules.yaml 위치 (classpath: 또는 파일 경로) */
    private String rulesPath = "classpath:rules.yaml";

    private Workers workers = new Workers();
    private Retry retry = new Retry();
    private Archive archive = new Archive();
    private Scheduler scheduler = new Scheduler();
    private Drafts drafts = new Drafts();
    private Logs logs = new Logs();

    @Data
    public static class Workers {
        private String feedUrl = "http://localhost:8001";
        private String generationUrl = "http://localhost:8002";
        private String imageUrl = "http://localhost:8003";
        /** 비어 있으면 원격 문서 저장소를 건너뛰고 로컬 아카이브만 사용 */
        private String archiveUrl = "";
        /** 있으면 모든 워커 호출에 X-API-Key 헤더로 실림 */
        private String apiKey = "";
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 40_000;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double multiplier = 2.0;
        private long maxBackoffMs = 4_000;
    }

    @Data
    public static class Archive {
        private String localDir = "./data/archive";
        private String publicBaseUrl = "http://localhost:8080";
    }

    @Data
    public static class Scheduler {
        /** false 면 소스 타이머를 걸지 않음 (수동 트리거만 동작) */
        private boolean autoStart = true;
        private int poolSize = 4;
        private long rulesWatchIntervalMs = 60_000;
        private String sweepCron = "0 30 3 * * *";
    }

    @Data
    public static class Drafts {
        private int poolSize = 4;
        private int historyLimit = 5;
    }

    @Data
    public static class Logs {
        private int capacity = 5_000;
    }
}
