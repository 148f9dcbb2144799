package com.vibecoding.fleetcatalog.mapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 업스트림 이름을 카탈로그 안전 이름으로 변환
 * 형식: [a-z0-9]+(-[a-z0-9]+)*, 최대 63자
 */
public final class EntityNames {

    public static final int MAX_NAME_LENGTH = 63;
    public static final String FALLBACK_NAME = "fleet-entity";

    private static final int HASH_LENGTH = 6;
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9-]");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");
    private static final Pattern LEADING_HYPHENS = Pattern.compile("^-+");
    private static final Pattern TRAILING_HYPHENS = Pattern.compile("-+$");

    private EntityNames() {
    }

    /**
     * 소문자화, 허용 외 문자를 '-' 로 치환, 63자 절단. 결과가 비면 fleet-entity
     */
    public static String toSafeName(String raw) {
        String clean = sanitize(raw);
        String trimmed = stripTrailingHyphens(clean.substring(0, Math.min(clean.length(), MAX_NAME_LENGTH)));
        return trimmed.isEmpty() ? FALLBACK_NAME : trimmed;
    }

    /**
     * maxLength 를 넘으면 앞부분 + '-' + SHA-1 6자리로 줄인다.
     * 같은 접두사를 가진 서로 다른 긴 이름도 구분된다.
     */
    public static String toStableSafeName(String raw, int maxLength) {
        String clean = sanitize(raw);
        if (clean.isEmpty()) {
            return FALLBACK_NAME;
        }
        if (clean.length() <= maxLength) {
            return clean;
        }

        String hash = shortHash(clean);
        int baseLength = Math.max(1, maxLength - HASH_LENGTH - 1);
        String base = stripTrailingHyphens(clean.substring(0, Math.min(clean.length(), baseLength)));
        String result = stripTrailingHyphens(base + "-" + hash);
        return result.isEmpty() ? FALLBACK_NAME + "-" + hash : result;
    }

    public static String toEntityNamespace(String fleetNamespace) {
        return toSafeName(fleetNamespace);
    }

    static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = INVALID_CHARS.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("-");
        value = REPEATED_HYPHENS.matcher(value).replaceAll("-");
        value = LEADING_HYPHENS.matcher(value).replaceAll("");
        return stripTrailingHyphens(value);
    }

    private static String stripTrailingHyphens(String value) {
        return TRAILING_HYPHENS.matcher(value).replaceAll("");
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // SHA-1 은 모든 JRE 에 포함됨
            throw new IllegalStateException("SHA-1 digest unavailable", e);
        }
    }
}
