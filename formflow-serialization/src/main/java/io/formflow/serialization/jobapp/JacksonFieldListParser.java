package io.formflow.serialization.jobapp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formflow.core.jobapp.FieldListParseException;
import io.formflow.core.jobapp.FieldListParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Jackson-based implementation of {@link FieldListParser}.
///
/// Accepts the shape the extraction prompt asks for,
/// ```json
/// {"fields": ["Full name", "Email", "Years of experience"]}
/// ```
/// and, since models do not always comply, a bare array of names. Markdown code fences
/// and prose around the JSON are stripped first. Blank names are dropped; non-string
/// entries are rendered as text.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is.
public class JacksonFieldListParser implements FieldListParser {

    private final ObjectMapper objectMapper;

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper the mapper to use for JSON parsing, not null
    public JacksonFieldListParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<String> parse(String content) throws FieldListParseException {
        Objects.requireNonNull(content, "content must not be null");
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(content));
        } catch (JsonProcessingException e) {
            throw new FieldListParseException(
                    "Failed to parse field list JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode fields = root != null && root.isObject() ? root.get("fields") : root;
        if (fields == null || !fields.isArray()) {
            throw new FieldListParseException(
                    "Expected {\"fields\": [...]} or a JSON array, got: " + abbreviate(content));
        }

        List<String> names = new ArrayList<>(fields.size());
        for (JsonNode field : fields) {
            String name = field.isTextual() ? field.asText().strip() : field.toString();
            if (!name.isBlank()) {
                names.add(name);
            }
        }
        return names;
    }

    /// Extracts the JSON content from a model response, stripping markdown fences.
    private static String extractJson(String content) {
        int start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        int objectStart = content.indexOf('{');
        int arrayStart = content.indexOf('[');
        boolean objectFirst = objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart);
        int from = objectFirst ? objectStart : arrayStart;
        int to = objectFirst ? content.lastIndexOf('}') : content.lastIndexOf(']');
        if (from >= 0 && to > from) {
            return content.substring(from, to + 1);
        }
        return content.trim();
    }

    private static String abbreviate(String content) {
        String flat = content.strip().replaceAll("\\s+", " ");
        return flat.length() <= 80 ? flat : flat.substring(0, 77) + "...";
    }
}
