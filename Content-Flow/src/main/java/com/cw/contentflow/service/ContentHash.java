package com.cw.contentflow.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 해시 (아이템 핑거프린트, rules 문서 지문)
 */
public final class ContentHash {

    private ContentHash() {
    }

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 링크 기준 핑거프린트. 링크가 없으면 제목으로 대체.
     * 프래그먼트와 끝 슬래시는 무시, 스킴/호스트 대소문자 무시.
     */
    public static String fingerprint(String link, String title) {
        String canonical = canonicalizeLink(link);
        if (canonical.isEmpty()) {
            return sha256Hex("|" + (title == null ? "" : title.trim()));
        }
        return sha256Hex(canonical);
    }

    static String canonicalizeLink(String link) {
        if (link == null) return "";
        String s = link.trim();
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        int schemeEnd = s.indexOf("://");
        if (schemeEnd > 0) {
            int pathStart = s.indexOf('/', schemeEnd + 3);
            String head = pathStart < 0 ? s : s.substring(0, pathStart);
            String tail = pathStart < 0 ? "" : s.substring(pathStart);
            s = head.toLowerCase(Locale.ROOT) + tail;
        }
        return s;
    }
}
