package com.smartpole.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.Getter;

/**
 * 端口的数据格式描述，类似 caps 字符串，例如 {@code application/x-rtp, media=video}。
 * 媒体类型相同（或任一方为 ANY）且双方共有的字段取值一致时视为兼容。
 */
@Getter
public final class PortShape {

    public static final String ANY_MEDIA_TYPE = "ANY";

    public static final PortShape ANY = new PortShape(ANY_MEDIA_TYPE, Collections.emptyMap());

    private final String mediaType;
    private final Map<String, String> fields;

    public PortShape(String mediaType, Map<String, String> fields) {
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 解析 caps 风格字符串。null 或空字符串解析为 {@link #ANY}。
     */
    public static PortShape parse(String text) {
        if (text == null || text.isBlank()) {
            return ANY;
        }
        String[] parts = text.split(",");
        String mediaType = parts[0].trim();
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i].trim();
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("非法的格式字段: '%s' in '%s'".formatted(part, text));
            }
            fields.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
        }
        return ANY_MEDIA_TYPE.equals(mediaType) && fields.isEmpty() ? ANY : new PortShape(mediaType, fields);
    }

    public boolean isAny() {
        return ANY_MEDIA_TYPE.equals(mediaType);
    }

    public boolean isCompatibleWith(PortShape other) {
        if (other == null) {
            return false;
        }
        if (!isAny() && !other.isAny() && !mediaType.equals(other.mediaType)) {
            return false;
        }
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            String theirs = other.fields.get(entry.getKey());
            if (theirs != null && !theirs.equals(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PortShape)) {
            return false;
        }
        PortShape that = (PortShape) o;
        return mediaType.equals(that.mediaType) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mediaType, fields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(mediaType);
        fields.forEach((k, v) -> sb.append(", ").append(k).append('=').append(v));
        return sb.toString();
    }
}
