package com.modporter.logic.mapping;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.modporter.logic.mapping.MappingModel.ApiMapping;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Gson setup for the persisted mapping format: a flat JSON array with ISO-8601 timestamps.
 */
final class MappingJson {

    private MappingJson() {}

    static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    static String toJson(Object value) {
        return GSON.toJson(value);
    }

    /**
     * Parses stored records, repairing the legacy shapes older stores carry. Records that
     * still fail to parse or validate are reported to {@code onSkip} and left out.
     */
    static List<ApiMapping> parseRecords(JsonArray array, Consumer<String> onSkip) {
        List<ApiMapping> mappings = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonElement element = array.get(i);
            if (!element.isJsonObject()) {
                onSkip.accept("record " + i + " is not an object");
                continue;
            }
            JsonObject record = element.getAsJsonObject().deepCopy();
            normalize(record);
            try {
                ApiMapping mapping = GSON.fromJson(record, ApiMapping.class);
                List<String> errors = MappingValidator.storedRecordErrors(mapping);
                if (!errors.isEmpty()) {
                    onSkip.accept("record " + i + ": " + String.join("; ", errors));
                    continue;
                }
                mappings.add(mapping);
            } catch (JsonParseException e) {
                onSkip.accept("record " + i + ": " + e.getMessage());
            }
        }
        return mappings;
    }

    private static void normalize(JsonObject record) {
        if (!record.has("createdAt") && record.has("lastUpdated")) {
            record.add("createdAt", record.get("lastUpdated"));
        }
        JsonElement version = record.get("version");
        if (version == null || version.isJsonNull()
                || (version.isJsonPrimitive() && version.getAsJsonPrimitive().isString())) {
            record.add("version", new JsonPrimitive(1));
        }
    }

    static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("Expected ISO-8601 timestamp at " + in.getPath());
            }
            String text = in.nextString();
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                try {
                    return OffsetDateTime.parse(text).toInstant();
                } catch (DateTimeParseException again) {
                    throw new JsonParseException("Invalid timestamp '" + text + "'", again);
                }
            }
        }
    }
}
