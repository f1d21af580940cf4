package com.cw.contentflow.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * @Scheduled 작업(룰 파일 감시) 활성화. 테스트에서는 auto-start=false 로 꺼둔다.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "contentflow.scheduler", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
