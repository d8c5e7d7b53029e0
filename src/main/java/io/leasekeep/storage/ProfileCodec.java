package io.leasekeep.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leasekeep.model.ProfileRecord;
import io.leasekeep.model.RecordMetadata;
import io.leasekeep.model.SessionId;
import io.leasekeep.util.Jsons;

public final class ProfileCodec {
    private ProfileCodec() {
    }

    public static String encode(ProfileRecord record) {
        ObjectNode root = Jsons.compact().createObjectNode();
        root.set("data", record.data());
        root.set("metaTags", record.metaTags());
        ObjectNode meta = root.putObject("metadata");
        meta.set("activeSession", sessionNode(record.metadata().activeSession()));
        meta.set("forceLoadSession", sessionNode(record.metadata().forceLoadSession()));
        meta.put("sessionLoadCount", record.metadata().sessionLoadCount());
        meta.put("profileCreateTime", record.metadata().profileCreateTime());
        meta.put("lastUpdate", record.metadata().lastUpdate());
        try {
            return Jsons.compact().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode profile record", e);
        }
    }

    public static ProfileRecord decode(String storeName, String key, String raw) {
        JsonNode root;
        try {
            root = Jsons.compact().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DataCorruptionException(storeName, key, "not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new DataCorruptionException(storeName, key, "root is not an object", null);
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new DataCorruptionException(storeName, key, "data is missing or not an object", null);
        }
        JsonNode metaTags = root.get("metaTags");
        if (metaTags != null && !metaTags.isNull() && !metaTags.isObject()) {
            throw new DataCorruptionException(storeName, key, "metaTags is not an object", null);
        }
        JsonNode meta = root.get("metadata");
        if (meta == null || !meta.isObject()) {
            throw new DataCorruptionException(storeName, key, "metadata is missing or not an object", null);
        }
        RecordMetadata metadata = new RecordMetadata(
                readSession(storeName, key, meta, "activeSession"),
                readSession(storeName, key, meta, "forceLoadSession"),
                readLong(storeName, key, meta, "sessionLoadCount"),
                readLong(storeName, key, meta, "profileCreateTime"),
                readLong(storeName, key, meta, "lastUpdate")
        );
        ObjectNode tags = metaTags == null || metaTags.isNull()
                ? Jsons.compact().createObjectNode()
                : (ObjectNode) metaTags;
        return new ProfileRecord((ObjectNode) data, tags, metadata);
    }

    private static JsonNode sessionNode(SessionId session) {
        if (session == null) {
            return Jsons.compact().nullNode();
        }
        ObjectNode node = Jsons.compact().createObjectNode();
        node.put("processId", session.processId());
        node.put("jobId", session.jobId());
        return node;
    }

    private static SessionId readSession(String storeName, String key, JsonNode meta, String field) {
        JsonNode node = meta.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode processId = node.get("processId");
        JsonNode jobId = node.get("jobId");
        if (processId == null || !processId.isTextual() || jobId == null || !jobId.isTextual()) {
            throw new DataCorruptionException(storeName, key, field + " is malformed", null);
        }
        return new SessionId(processId.asText(), jobId.asText());
    }

    private static long readLong(String storeName, String key, JsonNode meta, String field) {
        JsonNode node = meta.get(field);
        if (node == null || !node.canConvertToLong()) {
            throw new DataCorruptionException(storeName, key, field + " is missing or not an integer", null);
        }
        return node.asLong();
    }
}
