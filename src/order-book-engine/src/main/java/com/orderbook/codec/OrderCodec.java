package com.orderbook.codec;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;
import com.orderbook.domain.Trade;
import com.orderbook.error.InvalidOrderException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * JSON wire format for orders and trades.
 *
 * Prices and quantities are written as JSON integers and read back with
 * exact integer conversion: a fractional or out-of-range value is rejected,
 * never rounded through a double.
 */
public class OrderCodec {

    private final Gson gson;

    public OrderCodec() {
        this.gson = new Gson();
    }

    public String encodeOrder(Order order) {
        JsonObject json = new JsonObject();
        json.addProperty("orderId", order.getId().value());
        json.addProperty("symbol", order.getSymbol());
        json.addProperty("side", order.getSide().name());
        json.addProperty("price", order.getLimitPrice().cents());
        json.addProperty("quantity", order.getRemainingQuantity());
        json.addProperty("originalQuantity", order.getOriginalQuantity());
        json.addProperty("filledQuantity", order.getFilledQuantity());
        json.addProperty("timestamp", order.getTimestamp());
        json.addProperty("sequence", order.getSequence());
        json.addProperty("status", order.getStatus().name());
        return gson.toJson(json);
    }

    public String encodeTrade(Trade trade) {
        JsonObject json = new JsonObject();
        json.addProperty("type", "TRADE_EXECUTED");
        json.addProperty("tradeId", trade.getTradeId());
        json.addProperty("symbol", trade.getSymbol());
        json.addProperty("makerOrderId", trade.getMakerOrderId().value());
        json.addProperty("takerOrderId", trade.getTakerOrderId().value());
        json.addProperty("buyOrderId", trade.getBuyOrderId().value());
        json.addProperty("sellOrderId", trade.getSellOrderId().value());
        json.addProperty("takerSide", trade.getTakerSide().name());
        json.addProperty("price", trade.getPrice().cents());
        json.addProperty("quantity", trade.getQuantity());
        json.addProperty("timestamp", trade.getTimestamp());
        return gson.toJson(json);
    }

    /**
     * Parse a new order. {@code timestamp} is optional and defaults to now;
     * business rules (positive price and quantity) are left to the book.
     *
     * @throws InvalidOrderException if the JSON is malformed, a required field
     *         is missing, the side is unknown, or a number is not an exact integer
     */
    public Order decodeOrder(String body) {
        JsonObject json = parseObject(body);
        String orderId = requireString(json, "orderId");
        String symbol = requireString(json, "symbol");
        Side side = parseSide(requireString(json, "side"));
        long price = requireLong(json, "price");
        long quantity = requireLong(json, "quantity");
        long timestamp = json.has("timestamp") && !json.get("timestamp").isJsonNull()
                ? requireLong(json, "timestamp")
                : System.currentTimeMillis();

        return new Order(new OrderId(orderId), symbol, side, new Price(price), quantity, timestamp);
    }

    public Trade decodeTrade(String body) {
        JsonObject json = parseObject(body);
        return new Trade(
                requireLong(json, "tradeId"),
                requireString(json, "symbol"),
                new OrderId(requireString(json, "makerOrderId")),
                new OrderId(requireString(json, "takerOrderId")),
                parseSide(requireString(json, "takerSide")),
                new Price(requireLong(json, "price")),
                requireLong(json, "quantity"),
                requireLong(json, "timestamp"));
    }

    private static JsonObject parseObject(String body) {
        if (body == null) {
            throw new InvalidOrderException("Body must not be null");
        }
        try {
            JsonElement element = JsonParser.parseString(body);
            if (!element.isJsonObject()) {
                throw new InvalidOrderException("Expected a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new InvalidOrderException("Malformed JSON: " + e.getMessage());
        }
    }

    private static Side parseSide(String value) {
        try {
            return Side.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOrderException("Invalid side: " + value);
        }
    }

    private static String requireString(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new InvalidOrderException("Missing field: " + field);
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new InvalidOrderException("Field " + field + " must be a string");
        }
        return element.getAsString();
    }

    private static long requireLong(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new InvalidOrderException("Missing field: " + field);
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new InvalidOrderException("Field " + field + " must be an integer");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        try {
            return new BigDecimal(primitive.getAsString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidOrderException(
                    "Field " + field + " must be an integer: " + primitive.getAsString());
        }
    }
}
