package com.cw.contentflow.service;

import com.cw.contentflow.DTO.RulesConfig;
import com.cw.contentflow.DTO.RulesSnapshot;
import com.cw.contentflow.DTO.SourceDescriptor;
import com.cw.contentflow.config.ContentFlowProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.*;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * rules.yaml 로더.
 * 파싱 + 검증까지 끝난 스냅샷만 돌려주고, 문제가 있으면 RulesException (이전 스냅샷 유지는 호출 쪽 책임).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RulesLoader {
    private final ResourceLoader resourceLoader;
    private final ContentFlowProperties properties;
    private final Clock clock;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final Pattern INTERVAL = Pattern.compile("^(\\d+)([mh])$");
    private static final Pattern HH_MM = Pattern.compile("^\\d{1,2}:\\d{2}$");

    public RulesSnapshot load() {
        byte[] bytes = readBytes();
        RulesConfig rules;
        try {
            rules = YAML.readValue(bytes, RulesConfig.class);
        } catch (IOException e) {
            throw new RulesException("rules document is not valid YAML: " + e.getMessage(), e);
        }
        if (rules == null) {
            rules = new RulesConfig();
        }
        ZoneId zone = validate(rules);

        String fingerprint = ContentHash.sha256Hex(bytes);
        log.info("📜 rules 로드 완료: 소스 {}개, 활성 플랫폼 {} (fingerprint={})",
                rules.getSources().size(), rules.enabledPlatforms(), fingerprint.substring(0, 12));
        return new RulesSnapshot(rules, fingerprint, zone, LocalDateTime.now(clock));
    }

    /**
     * 파일 변경 감지용 지문. 읽을 수 없으면 RulesException.
     */
    public String currentFingerprint() {
        return ContentHash.sha256Hex(readBytes());
    }

    private byte[] readBytes() {
        String path = properties.getRulesPath();
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new RulesException("rules document not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new RulesException("rules document unreadable: " + path, e);
        }
    }

    private static ZoneId validate(RulesConfig rules) {
        ZoneId zone;
        try {
            zone = ZoneId.of(rules.getGlobalConfig().getTimezone());
        } catch (DateTimeException e) {
            throw new RulesException("invalid timezone: " + rules.getGlobalConfig().getTimezone(), e);
        }
        if (rules.getGlobalConfig().getMemoryRetentionDays() < 0) {
            throw new RulesException("memory_retention_days must be >= 0");
        }

        Set<String> ids = new HashSet<>();
        for (SourceDescriptor source : rules.getSources()) {
            if (source.getId() == null || source.getId().isBlank()) {
                throw new RulesException("source without id");
            }
            if (!ids.add(source.getId())) {
                throw new RulesException("duplicate source id: " + source.getId());
            }
            if (source.getUrl() == null || source.getUrl().isBlank()) {
                throw new RulesException("source " + source.getId() + " has no url");
            }
            parseInterval(source.getFetchInterval());
        }
        rules.getPlatforms().forEach((name, policy) -> {
            if (policy != null && policy.getSchedule() != null && !policy.getSchedule().isBlank()) {
                parseSchedule(policy.getSchedule());
            }
        });
        return zone;
    }

    /**
     * "30m", "2h" → Duration
     */
    public static Duration parseInterval(String value) {
        Matcher m = INTERVAL.matcher(value == null ? "" : value.trim().toLowerCase());
        if (!m.matches()) {
            throw new RulesException("invalid fetch_interval (expected <n>m or <n>h): " + value);
        }
        long amount = Long.parseLong(m.group(1));
        if (amount <= 0) {
            throw new RulesException("fetch_interval must be positive: " + value);
        }
        return "h".equals(m.group(2)) ? Duration.ofHours(amount) : Duration.ofMinutes(amount);
    }

    /**
     * "HH:MM" → LocalTime
     */
    public static LocalTime parseSchedule(String value) {
        String v = value == null ? "" : value.trim();
        if (!HH_MM.matcher(v).matches()) {
            throw new RulesException("invalid schedule (expected HH:MM): " + value);
        }
        String[] parts = v.split(":");
        try {
            return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (DateTimeException | NumberFormatException e) {
            throw new RulesException("invalid schedule (expected HH:MM): " + value, e);
        }
    }
}
