package com.smartpole.core.toggle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 节点上一个可在运行时修改的参数的声明。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class ParameterSpec {

    @JsonProperty("key")
    private String key;

    @JsonProperty("type")
    private ParameterType type;

    /**
     * ENUM 类型的可选值
     */
    @JsonProperty("values")
    private List<String> values = new ArrayList<>();

    /**
     * INTEGER 类型的取值范围，null 表示不限
     */
    @JsonProperty("min")
    private Long min;

    @JsonProperty("max")
    private Long max;

    @JsonProperty("default")
    private Object defaultValue;

    public static ParameterSpec bool(String key, boolean defaultValue) {
        return new ParameterSpec().setKey(key).setType(ParameterType.BOOLEAN).setDefaultValue(defaultValue);
    }

    public static ParameterSpec enumeration(String key, List<String> values, String defaultValue) {
        return new ParameterSpec().setKey(key).setType(ParameterType.ENUM).setValues(new ArrayList<>(values))
                .setDefaultValue(defaultValue);
    }

    public static ParameterSpec integer(String key, Long min, Long max, long defaultValue) {
        return new ParameterSpec().setKey(key).setType(ParameterType.INTEGER).setMin(min).setMax(max)
                .setDefaultValue(defaultValue);
    }

    /**
     * 校验并转换为规范类型（Boolean / String / Long）。
     *
     * @throws IllegalArgumentException 值不合法，消息即拒绝原因
     */
    public Object coerce(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("值不能为空");
        }
        switch (type) {
            case BOOLEAN:
                return coerceBoolean(value);
            case ENUM:
                String text = value.toString();
                if (!values.contains(text)) {
                    throw new IllegalArgumentException("'%s' 不在可选值 %s 中".formatted(text, values));
                }
                return text;
            case INTEGER:
                long number = coerceLong(value);
                if (min != null && number < min) {
                    throw new IllegalArgumentException("%d 小于最小值 %d".formatted(number, min));
                }
                if (max != null && number > max) {
                    throw new IllegalArgumentException("%d 大于最大值 %d".formatted(number, max));
                }
                return number;
            default:
                throw new IllegalArgumentException("未知的参数类型: " + type);
        }
    }

    private static Boolean coerceBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            long n = ((Number) value).longValue();
            if (n == 0 || n == 1) {
                return n == 1;
            }
            throw new IllegalArgumentException("不是布尔值: " + value);
        }
        switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "on":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "off":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("不是布尔值: " + value);
        }
    }

    private static long coerceLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("不是整数: " + value);
        }
    }
}
