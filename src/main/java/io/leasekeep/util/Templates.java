package io.leasekeep.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

public final class Templates {
    private Templates() {
    }

    public static ObjectNode copyOf(ObjectNode template) {
        return template == null ? Jsons.mapper().createObjectNode() : template.deepCopy();
    }

    public static void reconcile(ObjectNode target, ObjectNode template) {
        if (target == null || template == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = template.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode existing = target.get(entry.getKey());
            JsonNode defaults = entry.getValue();
            if (existing == null) {
                target.set(entry.getKey(), defaults.deepCopy());
            } else if (existing.isObject() && defaults.isObject()) {
                reconcile((ObjectNode) existing, (ObjectNode) defaults);
            }
        }
    }
}
