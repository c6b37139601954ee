package com.github.spud.sample.ai.orchestrator.domain.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

/**
 * 配置分层深度合并
 * <p>
 * 按参数顺序合并：对象值逐键递归合并，其余类型（包括数组与 null）整体被后一层替换。
 */
public final class ConfigLayering {

  private ConfigLayering() {
  }

  public static ObjectNode merge(JsonNode... layers) {
    ObjectNode result = JsonNodeFactory.instance.objectNode();
    for (JsonNode layer : layers) {
      if (layer != null && layer.isObject()) {
        mergeInto(result, (ObjectNode) layer);
      }
    }
    return result;
  }

  private static void mergeInto(ObjectNode target, ObjectNode source) {
    Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isObject()) {
        JsonNode existing = target.get(field.getKey());
        ObjectNode nested = JsonNodeFactory.instance.objectNode();
        if (existing != null && existing.isObject()) {
          mergeInto(nested, (ObjectNode) existing);
        }
        mergeInto(nested, (ObjectNode) value);
        target.set(field.getKey(), nested);
      } else {
        target.set(field.getKey(), value.deepCopy());
      }
    }
  }
}
