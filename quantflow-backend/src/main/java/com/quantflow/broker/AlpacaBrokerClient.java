package com.quantflow.broker;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantflow.config.TradingConfig;
import com.quantflow.core.error.MarketDataException;
import com.quantflow.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the Alpaca trading and market data APIs.
 * Uses Jackson for JSON and reads prices as exact decimals.
 */
public final class AlpacaBrokerClient implements BrokerClient {
    private static final Logger logger = LoggerFactory.getLogger(AlpacaBrokerClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final int PAGE_LIMIT = 10_000;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String tradingUrl;
    private final String dataUrl;
    private final String apiKey;
    private final String apiSecret;
    private final String timeframe;

    public AlpacaBrokerClient(TradingConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build());
    }

    AlpacaBrokerClient(TradingConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.tradingUrl = config.getBrokerBaseUrl();
        this.dataUrl = config.getMarketDataUrl();
        this.apiKey = config.getApiKey();
        this.apiSecret = config.getApiSecret();
        this.timeframe = config.getBarTimeframe();
        logger.info("AlpacaBrokerClient initialized for {} (data {}, timeframe {})", tradingUrl, dataUrl, timeframe);
    }

    @Override
    public List<Bar> getBars(String instrument, Instant start, Instant end) {
        logger.debug("Fetching {} bars for {} in [{}, {})", timeframe, instrument, start, end);
        var bars = new ArrayList<Bar>();
        String pageToken = null;
        do {
            var url = new StringBuilder(String.format("%s/v2/stocks/%s/bars?timeframe=%s&adjustment=raw&feed=iex&limit=%d",
                dataUrl, instrument, timeframe, PAGE_LIMIT))
                .append("&start=").append(encode(start.toString()))
                .append("&end=").append(encode(end.toString()));
            if (pageToken != null) {
                url.append("&page_token=").append(encode(pageToken));
            }

            JsonNode root = readTree(sendRequest(url.toString(), "GET", null));
            JsonNode barsArray = root.get("bars");
            if (barsArray != null && barsArray.isArray()) {
                for (var barNode : barsArray) {
                    Bar bar = toBar(barNode);
                    // Alpaca treats end as inclusive
                    if (bar.timestamp().isBefore(end)) {
                        bars.add(bar);
                    }
                }
            }
            JsonNode next = root.get("next_page_token");
            pageToken = next == null || next.isNull() ? null : next.asText();
        } while (pageToken != null);

        logger.debug("Retrieved {} bars for {}", bars.size(), instrument);
        return bars;
    }

    @Override
    public BrokerOrder submitOrder(OrderRequest request) {
        var order = objectMapper.createObjectNode()
            .put("symbol", request.instrument())
            .put("qty", Long.toString(request.quantity()))
            .put("side", request.side())
            .put("type", request.type())
            .put("time_in_force", "day");
        if (request.limitPrice() != null) {
            order.put("limit_price", request.limitPrice().setScale(2, RoundingMode.HALF_UP).toPlainString());
        }
        if (request.clientOrderId() != null) {
            order.put("client_order_id", request.clientOrderId());
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(order);
        } catch (IOException e) {
            throw new BrokerException("Could not encode order", e, false);
        }
        logger.info("Placing order: {}", body);
        return toOrder(readTree(sendRequest(tradingUrl + "/v2/orders", "POST", body)));
    }

    @Override
    public BrokerOrder getOrder(String orderId) {
        return toOrder(readTree(sendRequest(tradingUrl + "/v2/orders/" + orderId, "GET", null)));
    }

    @Override
    public void cancelOrder(String orderId) {
        logger.info("Cancelling order {}", orderId);
        sendRequest(tradingUrl + "/v2/orders/" + orderId, "DELETE", null);
    }

    @Override
    public long getPositionQuantity(String instrument) {
        try {
            JsonNode position = readTree(sendRequest(tradingUrl + "/v2/positions/" + instrument, "GET", null));
            return new BigDecimal(position.get("qty").asText()).longValueExact();
        } catch (BrokerException e) {
            if (e.statusCode() == 404) {
                logger.debug("No position found for {}", instrument);
                return 0;
            }
            throw e;
        }
    }

    private Bar toBar(JsonNode node) {
        try {
            return new Bar(Instant.parse(node.get("t").asText()),
                node.get("o").decimalValue(),
                node.get("h").decimalValue(),
                node.get("l").decimalValue(),
                node.get("c").decimalValue(),
                node.get("v").asLong());
        } catch (NullPointerException | DateTimeParseException e) {
            throw new MarketDataException("Malformed bar from broker: " + node, e);
        }
    }

    private BrokerOrder toOrder(JsonNode node) {
        JsonNode avg = node.get("filled_avg_price");
        JsonNode qty = node.get("filled_qty");
        return new BrokerOrder(node.get("id").asText(), node.get("status").asText(),
            qty == null || qty.isNull() ? 0 : new BigDecimal(qty.asText()).longValue(),
            avg == null || avg.isNull() ? null : new BigDecimal(avg.asText()));
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new BrokerException("Unreadable broker response", e, false);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String sendRequest(String url, String method, String body) {
        var builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("APCA-API-KEY-ID", apiKey)
            .header("APCA-API-SECRET-KEY", apiSecret)
            .header("Content-Type", "application/json")
            .timeout(REQUEST_TIMEOUT);

        var request = switch (method) {
            case "GET" -> builder.GET().build();
            case "POST" -> builder.POST(HttpRequest.BodyPublishers.ofString(body != null ? body : "{}")).build();
            case "DELETE" -> builder.DELETE().build();
            default -> throw new IllegalArgumentException(String.format("Unsupported HTTP method: %s", method));
        };

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BrokerException(method + " " + url + " failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException(method + " " + url + " interrupted", e, false);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        var errorMsg = String.format("API request failed: %d - %s", status, response.body());
        if (status == 404) {
            logger.debug(errorMsg);
        } else if (status == 429) {
            logger.warn("API rate limit (429) on {}", url);
        } else {
            logger.error(errorMsg);
        }
        throw new BrokerException(errorMsg, status);
    }
}
