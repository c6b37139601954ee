package com.github.spud.sample.ai.orchestrator.infrastructure.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .findAndRegisterModules()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, clazz), Exception.class);
  }

  public static JsonNode toTree(Object value) {
    return objectMapper.valueToTree(value);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
    }), Exception.class);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<List<Object>>() {
    }), Exception.class);
  }

}
