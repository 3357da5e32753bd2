package com.patentflow.orchestrator.codec;

import com.patentflow.orchestrator.stage.StageInputs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Transport encoding shared with the remote compute service.
 *
 * Wire format: value → UTF-8 bytes (JSON for structured values) → gzip → base64.
 *
 * Binary values cannot travel inside JSON directly, so they are tagged:
 * <pre>
 *   {"__type__": "bytes",    "__data__": "&lt;base64&gt;"}   → byte[]
 *   {"__type__": "tuple",    "__data__": [...]}          → List
 *   {"__type__": "str_repr", "__data__": "..."}          → String
 *   {"__type__": "object",   "__data__": {...}}          → its data, restored
 * </pre>
 * Tags may appear at any depth; {@link #restore} walks the whole tree.
 */
@Component
public class PayloadCodec {

    static final String TYPE = "__type__";
    static final String DATA = "__data__";

    private final ObjectMapper json;

    public PayloadCodec(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Text
    // ------------------------------------------------------------------

    public String compressText(String text) {
        return Base64.getEncoder().encodeToString(gzip(text.getBytes(StandardCharsets.UTF_8)));
    }

    public String decompressText(String base64) {
        return new String(gunzip(decodeBase64(base64)), StandardCharsets.UTF_8);
    }

    /** Lenient base64 decoding: line breaks inside the data are ignored. */
    public static byte[] decodeBase64(String base64) {
        try {
            return Base64.getMimeDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new PayloadCodecException("Invalid base64 data", e);
        }
    }

    /** Plain base64 of the UTF-8 text, no compression. */
    public static String textToBase64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    // ------------------------------------------------------------------
    // JSON
    // ------------------------------------------------------------------

    public String compressJson(Object value) {
        try {
            byte[] raw = json.writeValueAsBytes(tag(value));
            return Base64.getEncoder().encodeToString(gzip(raw));
        } catch (IOException e) {
            throw new PayloadCodecException("JSON serialization failed", e);
        }
    }

    /** Parse JSON text and compress it like any other structured value. Blank text is an empty list. */
    public String compressJsonText(String jsonText) {
        if (jsonText == null || jsonText.isBlank()) {
            return compressJson(List.of());
        }
        try {
            return compressJson(json.readValue(jsonText, Object.class));
        } catch (IOException e) {
            throw new PayloadCodecException("Field does not hold valid JSON", e);
        }
    }

    public Object decompressJson(String base64) {
        byte[] raw = gunzip(decodeBase64(base64));
        try {
            return restore(json.readValue(raw, Object.class));
        } catch (IOException e) {
            throw new PayloadCodecException("Result blob is not valid JSON", e);
        }
    }

    /**
     * Decode a result blob that must hold a JSON object. A blank blob is an
     * empty result, not an error.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> decompressJsonObject(String base64) {
        if (base64 == null || base64.isBlank()) {
            return Map.of();
        }
        Object decoded = decompressJson(base64);
        if (!(decoded instanceof Map)) {
            throw new PayloadCodecException("Result blob must be a JSON object, got "
                    + (decoded == null ? "null" : decoded.getClass().getSimpleName()));
        }
        return (Map<String, Object>) decoded;
    }

    /**
     * Earlier stage outputs, sent back so the remote side can resume from them:
     * a compressed JSON list of {base64, original_filename}, skipping blank fields.
     *
     * @param fieldToFileName record field → file name the remote side expects
     */
    public String midFiles(StageInputs inputs, Map<String, String> fieldToFileName) {
        List<Map<String, String>> files = new ArrayList<>();
        fieldToFileName.forEach((field, fileName) -> {
            String content = inputs.text(field);
            if (!content.isBlank()) {
                Map<String, String> item = new LinkedHashMap<>();
                item.put("base64", compressText(content));
                item.put("original_filename", fileName);
                files.add(item);
            }
        });
        return compressJson(files);
    }

    // ------------------------------------------------------------------
    // Tagged values
    // ------------------------------------------------------------------

    /** Replace tagged maps with the values they stand for, recursively. */
    public Object restore(Object value) {
        if (value instanceof Map<?, ?> map) {
            Object type = map.get(TYPE);
            if (type instanceof String tag && map.containsKey(DATA)) {
                Object data = map.get(DATA);
                return switch (tag) {
                    case "bytes"    -> decodeBase64(String.valueOf(data));
                    case "tuple"    -> restore(data);
                    case "str_repr" -> String.valueOf(data);
                    case "object"   -> restore(data);
                    default         -> restoreEntries(map);
                };
            }
            return restoreEntries(map);
        }
        if (value instanceof Collection<?> items) {
            List<Object> restored = new ArrayList<>(items.size());
            for (Object item : items) restored.add(restore(item));
            return restored;
        }
        return value;
    }

    private Map<String, Object> restoreEntries(Map<?, ?> map) {
        Map<String, Object> restored = new LinkedHashMap<>();
        map.forEach((k, v) -> restored.put(String.valueOf(k), restore(v)));
        return restored;
    }

    private Object tag(Object value) {
        if (value instanceof byte[] bytes) {
            Map<String, Object> tagged = new LinkedHashMap<>();
            tagged.put(TYPE, "bytes");
            tagged.put(DATA, Base64.getEncoder().encodeToString(bytes));
            return tagged;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), tag(v)));
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) out.add(tag(item));
            return out;
        }
        return value;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static byte[] gzip(byte[] raw) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new PayloadCodecException("gzip compression failed", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed) {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gz.readAllBytes();
        } catch (IOException e) {
            throw new PayloadCodecException("gzip decompression failed", e);
        }
    }
}
