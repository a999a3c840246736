package com.fintech.ticks.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.ticks.domain.Trade;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes raw feed frames into {@link FeedMessage}s.
 *
 * <p>Recognized shapes:
 * <ul>
 *   <li>{@code {"type":"trade","data":[{"s":"AAPL","p":189.5,"t":1700000000000,"v":10}, ...]}}</li>
 *   <li>{@code {"type":"ping"}}</li>
 *   <li>{@code {"type":"error","msg":"..."}}, or any object carrying only {@code msg}</li>
 * </ul>
 * Volume and trade conditions are accepted but not kept.
 */
public class FeedMessageDecoder {

    private final ObjectMapper objectMapper;

    public FeedMessageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws FeedProtocolException if the frame is not JSON or has an unknown shape
     */
    public FeedMessage decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new FeedProtocolException("Frame is not valid JSON", frame, e);
        }
        if (root == null || !root.isObject()) {
            throw new FeedProtocolException("Frame is not a JSON object", frame);
        }

        String type = root.path("type").asText("");
        switch (type) {
            case "trade":
                return new FeedMessage.TradeBatch(decodeTrades(root.path("data"), frame));
            case "ping":
                return new FeedMessage.KeepAlive();
            case "error":
                return new FeedMessage.FeedError(root.path("msg").asText(""));
            default:
                if (type.isEmpty() && root.hasNonNull("msg")) {
                    return new FeedMessage.FeedError(root.get("msg").asText());
                }
                throw new FeedProtocolException("Unknown frame type '" + type + "'", frame);
        }
    }

    private List<Trade> decodeTrades(JsonNode data, String frame) {
        if (!data.isArray()) {
            throw new FeedProtocolException("Trade frame without a data array", frame);
        }
        List<Trade> trades = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            JsonNode symbol = item.get("s");
            JsonNode price = item.get("p");
            JsonNode time = item.get("t");
            if (symbol == null || !symbol.isTextual()
                    || price == null || !price.isNumber()
                    || time == null || !time.canConvertToLong()) {
                throw new FeedProtocolException("Trade entry missing s, p or t: " + item, frame);
            }
            trades.add(new Trade(symbol.asText(), price.asDouble(), time.asLong()));
        }
        return trades;
    }
}
