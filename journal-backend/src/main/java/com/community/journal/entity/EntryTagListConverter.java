package com.community.journal.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * 标签列表 <-> JSON 文本列（例如 ["sport","good_sleep"]）。
 * 库中出现未知 id 时直接丢弃，写入端已经做过校验。
 */
@Converter
public class EntryTagListConverter implements AttributeConverter<List<EntryTag>, String> {

    // Hibernate 直接实例化转换器，拿不到 Spring 容器里的 ObjectMapper；只读写字符串列表，默认配置即可
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<EntryTag> tags) {
        List<String> ids = new ArrayList<>();
        if (tags != null) {
            tags.forEach(tag -> ids.add(tag.getId()));
        }
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize entry tags", e);
        }
    }

    @Override
    public List<EntryTag> convertToEntityAttribute(String json) {
        List<EntryTag> tags = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return tags;
        }
        try {
            for (String id : MAPPER.readValue(json, STRING_LIST)) {
                EntryTag.fromId(id).ifPresent(tags::add);
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read entry tags: " + json, e);
        }
        return tags;
    }
}
