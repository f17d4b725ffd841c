package com.s1export.collector.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A successful response body split into its records and the cursor for the next page.
 *
 * <p>Expected shape: {@code {"data": [...], "pagination": {"nextCursor": "...", "totalItems": 42}}}.
 * A {@code data} object counts as one record, a missing or null {@code data} as none,
 * and a bare JSON array body is taken as the record list itself.</p>
 *
 * @param records    records of this page, in server order
 * @param nextCursor cursor for the next page, or {@code null} when this is the last page
 * @param totalItems total reported by the server, or {@code null}
 */
public record PageEnvelope(List<JsonNode> records, String nextCursor, Long totalItems) {

    public PageEnvelope {
        records = List.copyOf(records);
    }

    public static PageEnvelope from(JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            return new PageEnvelope(List.of(), null, null);
        }
        if (body.isArray()) {
            return new PageEnvelope(elements(body), null, null);
        }
        if (!body.isObject()) {
            return new PageEnvelope(List.of(body), null, null);
        }

        JsonNode data = body.get("data");
        List<JsonNode> records;
        if (data == null || data.isNull()) {
            records = List.of();
        } else if (data.isArray()) {
            records = elements(data);
        } else {
            records = List.of(data);
        }

        JsonNode pagination = body.path("pagination");
        JsonNode cursorNode = pagination.path("nextCursor");
        String nextCursor = cursorNode.isValueNode() && !cursorNode.isNull() && !cursorNode.asText().isBlank()
                ? cursorNode.asText() : null;
        JsonNode totalNode = pagination.path("totalItems");
        Long totalItems = totalNode.isIntegralNumber() ? totalNode.asLong() : null;

        return new PageEnvelope(records, nextCursor, totalItems);
    }

    public boolean hasNextPage() {
        return nextCursor != null;
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> elements = new ArrayList<>(array.size());
        array.forEach(elements::add);
        return elements;
    }
}
