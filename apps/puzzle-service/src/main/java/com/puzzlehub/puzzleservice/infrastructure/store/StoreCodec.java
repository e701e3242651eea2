package com.puzzlehub.puzzleservice.infrastructure.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 记录对象 ⇄ 扁平字段表 的转换。
 * 记录类只允许标量字段（字符串、数字、布尔、枚举），null 字段不落库。
 * 存储层读回的数字类型可能与写入时不同（Integer/Long/Double 混用），统一在这里做类型收敛。
 */
@Component
public class StoreCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Map<String, Object> toFields(Object record) {
        return mapper.convertValue(record, FIELDS);
    }

    /**
     * @return 字段表为空（路径不存在）时返回 null
     */
    public <T> T fromFields(Map<String, Object> fields, Class<T> type) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        return mapper.convertValue(fields, type);
    }

    public static long asLong(Object v) {
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            return Long.parseLong(s.trim());
        }
        return 0L;
    }
}
