package com.fxtrader.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical view of an exchange response envelope {@code {status, data, messages}}.
 *
 * The exchange returns {@code data} as a list, a single object, or an object wrapping
 * {@code list}; all three are flattened into {@link #data()}.
 */
public record ApiEnvelope(int status, List<JsonNode> data, List<Message> messages) {

    public static final String THROTTLE_CODE = "ERR-5003";

    public record Message(String code, String text) {
        @Override
        public String toString() {
            return code + ": " + text;
        }
    }

    public ApiEnvelope {
        data = List.copyOf(data);
        messages = List.copyOf(messages);
    }

    public static ApiEnvelope parse(ObjectMapper mapper, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ApiException(ApiException.Kind.MALFORMED, "Unparseable response: " + abbreviate(body), e);
        }
        if (root == null || !root.isObject() || !root.has("status")) {
            throw new ApiException(ApiException.Kind.MALFORMED, "Response has no status: " + abbreviate(body));
        }
        return new ApiEnvelope(root.path("status").asInt(-1), flatten(root.path("data")), messages(root.path("messages")));
    }

    private static List<JsonNode> flatten(JsonNode data) {
        var items = new ArrayList<JsonNode>();
        if (data.isArray()) {
            data.forEach(items::add);
        } else if (data.isObject() && data.path("list").isArray()) {
            data.path("list").forEach(items::add);
        } else if (data.isObject()) {
            items.add(data);
        }
        return items;
    }

    private static List<Message> messages(JsonNode node) {
        var result = new ArrayList<Message>();
        if (node.isArray()) {
            for (JsonNode m : node) {
                result.add(new Message(m.path("message_code").asText(""), m.path("message_string").asText("")));
            }
        }
        return result;
    }

    public boolean isOk() {
        return status == 0;
    }

    public boolean isThrottled() {
        return messages.stream().anyMatch(m -> THROTTLE_CODE.equals(m.code()));
    }

    public String firstCode() {
        return messages.isEmpty() ? null : messages.get(0).code();
    }

    public String errorSummary() {
        if (messages.isEmpty()) {
            return "status " + status;
        }
        return messages.stream().map(Message::toString).collect(Collectors.joining("; "));
    }

    /**
     * First data element, or MALFORMED when the exchange returned none.
     */
    public JsonNode first(String what) {
        if (data.isEmpty()) {
            throw new ApiException(ApiException.Kind.MALFORMED, "No data in " + what + " response");
        }
        return data.get(0);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "<empty>";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
