package in.gts.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.gts.application.port.input.AssetRegistryService;
import in.gts.application.port.input.TradeOfferService;
import in.gts.application.service.EventService;
import in.gts.application.service.LedgerCoordinator;
import in.gts.application.service.PrincipalIndex;
import in.gts.domain.error.LedgerException;
import in.gts.domain.event.LedgerEvent;
import in.gts.domain.model.Asset;
import in.gts.domain.model.AssetData;
import in.gts.domain.model.Principal;
import in.gts.domain.model.TradeOffer;
import in.gts.security.InputValidator;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * HTTP API over the ledger.
 *
 * The calling principal comes from the X-Principal header set by the fronting
 * gateway. Ledger errors map to status codes through {@link in.gts.domain.common.LedgerErrorCode};
 * malformed input is 400. Also serves the Prometheus scrape of the ledger's metrics.
 */
public final class LedgerApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(LedgerApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static final String PRINCIPAL_HEADER = "X-Principal";

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    private static final String JSON_ERROR = "error";
    private static final String JSON_MESSAGE = "message";

    private final AssetRegistryService assets;
    private final TradeOfferService offers;
    private final EventService eventService;
    private final PrincipalIndex index;
    private final LedgerCoordinator coordinator;
    private final InputValidator validator;
    private final CollectorRegistry metricsRegistry;
    private final int eventPageLimit;

    public LedgerApiHandlers(
        AssetRegistryService assets,
        TradeOfferService offers,
        EventService eventService,
        PrincipalIndex index,
        LedgerCoordinator coordinator,
        InputValidator validator,
        CollectorRegistry metricsRegistry,
        int eventPageLimit
    ) {
        this.assets = assets;
        this.offers = offers;
        this.eventService = eventService;
        this.index = index;
        this.coordinator = coordinator;
        this.validator = validator;
        this.metricsRegistry = metricsRegistry;
        this.eventPageLimit = eventPageLimit;
    }

    /**
     * Route table. Handlers block on the ledger writer, so wrap the result in a
     * BlockingHandler before handing it to Undertow.
     */
    public RoutingHandler routes() {
        return Handlers.routing()
            .get("/metrics", this::metrics)
            .get("/api/health", this::health)
            .post("/api/assets", this::issueAsset)
            .get("/api/assets/{assetId}", this::getAsset)
            .delete("/api/assets/{assetId}", this::retractAsset)
            .get("/api/assets/{assetId}/events", this::assetHistory)
            .get("/api/principals/{principal}/inventory", this::inventory)
            .get("/api/principals/{principal}/offers/sent", this::offersSent)
            .get("/api/principals/{principal}/offers/received", this::offersReceived)
            .post("/api/offers", this::createOffer)
            .get("/api/offers/public", this::publicOffers)
            .get("/api/offers/{offerId}", this::getOffer)
            .post("/api/offers/{offerId}/cancel", this::cancelOffer)
            .post("/api/offers/{offerId}/accept", this::acceptOffer)
            .post("/api/offers/{offerId}/decline", this::declineOffer)
            .get("/api/offers/{offerId}/events", this::offerHistory)
            .get("/api/events", this::events)
            .setFallbackHandler(exchange -> error(exchange, 404, "NOT_FOUND",
                "No route for " + exchange.getRequestMethod() + " " + exchange.getRequestPath()));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HEALTH
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * GET /api/health - Liveness plus table sizes.
     */
    public void health(HttpServerExchange exchange) {
        handle(exchange, () -> {
            PrincipalIndex.IndexStats stats = coordinator.execute("health", index::getStats);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("status", "UP");
            response.put("owners", stats.owners());
            response.put("liveAssets", stats.indexedAssets());
            response.put("offers", stats.indexedOffers());
            response.put("publicOffers", stats.publicOffers());
            response.put("eventSeq", eventService.currentSeq());
            sendJson(exchange, 200, response);
        });
    }

    /**
     * GET /metrics - Prometheus text format. Export failures answer with the JSON error envelope.
     */
    public void metrics(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Writer writer = new StringWriter();
            TextFormat.write004(writer, metricsRegistry.metricFamilySamples());
            String body = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.getResponseSender().send(body, StandardCharsets.UTF_8);

            log.debug("Served ledger metrics ({} bytes)", body.length());
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ASSETS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * POST /api/assets - Issue an asset. Body: {"owner": "...", "data": "0x..."}.
     * Owner defaults to the caller.
     */
    public void issueAsset(HttpServerExchange exchange) {
        Principal caller = authenticate(exchange);
        if (caller == null) return;

        exchange.getRequestReceiver().receiveFullString((ex, body) -> handle(ex, () -> {
            JsonNode json = readBody(body);
            String ownerText = text(json, "owner");
            Principal owner = ownerText != null ? validator.principal(ownerText, "owner") : caller;
            AssetData data = validator.data(text(json, "data"));

            long assetId = assets.issue(caller, owner, data);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("assetId", assetId);
            sendJson(ex, 201, response);
        }), StandardCharsets.UTF_8);
    }

    /**
     * GET /api/assets/{assetId}
     */
    public void getAsset(HttpServerExchange exchange) {
        handle(exchange, () -> {
            long assetId = validator.id(pathParam(exchange, "assetId"), "assetId");
            Optional<Asset> asset = assets.get(assetId);
            if (asset.isEmpty()) {
                error(exchange, 404, "NOT_FOUND", "Asset " + assetId + " does not exist");
                return;
            }
            sendJson(exchange, 200, MAPPER.valueToTree(asset.get()));
        });
    }

    /**
     * DELETE /api/assets/{assetId} - Retract (emitter only).
     */
    public void retractAsset(HttpServerExchange exchange) {
        Principal caller = authenticate(exchange);
        if (caller == null) return;

        handle(exchange, () -> {
            long assetId = validator.id(pathParam(exchange, "assetId"), "assetId");
            assets.retract(caller, assetId);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("success", true);
            response.put("assetId", assetId);
            sendJson(exchange, 200, response);
        });
    }

    /**
     * GET /api/principals/{principal}/inventory
     */
    public void inventory(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Principal principal = validator.principal(pathParam(exchange, "principal"), "principal");
            Collection<Long> owned = assets.inventoryOf(principal);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("principal", principal.id());
            response.set("assetIds", idArray(owned));
            response.put("count", owned.size());
            sendJson(exchange, 200, response);
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // OFFERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * POST /api/offers - Body: {"recipient": "..." | "*" | absent, "myAssets": [...], "theirAssets": [...]}.
     */
    public void createOffer(HttpServerExchange exchange) {
        Principal caller = authenticate(exchange);
        if (caller == null) return;

        exchange.getRequestReceiver().receiveFullString((ex, body) -> handle(ex, () -> {
            JsonNode json = readBody(body);
            Principal recipient = validator.recipient(text(json, "recipient"));
            List<Long> myAssets = validator.assetIds(ids(json, "myAssets"), "myAssets");
            List<Long> theirAssets = validator.assetIds(ids(json, "theirAssets"), "theirAssets");

            long offerId = offers.sendTradeOffer(caller, recipient, myAssets, theirAssets);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("offerId", offerId);
            sendJson(ex, 201, response);
        }), StandardCharsets.UTF_8);
    }

    /**
     * GET /api/offers/{offerId}
     */
    public void getOffer(HttpServerExchange exchange) {
        handle(exchange, () -> {
            long offerId = validator.id(pathParam(exchange, "offerId"), "offerId");
            Optional<TradeOffer> offer = offers.get(offerId);
            if (offer.isEmpty()) {
                error(exchange, 404, "NOT_FOUND", "Offer " + offerId + " does not exist");
                return;
            }
            sendJson(exchange, 200, MAPPER.valueToTree(offer.get()));
        });
    }

    public void cancelOffer(HttpServerExchange exchange) {
        transition(exchange, Transition.CANCEL);
    }

    public void acceptOffer(HttpServerExchange exchange) {
        transition(exchange, Transition.ACCEPT);
    }

    public void declineOffer(HttpServerExchange exchange) {
        transition(exchange, Transition.DECLINE);
    }

    /**
     * GET /api/offers/public
     */
    public void publicOffers(HttpServerExchange exchange) {
        handle(exchange, () -> {
            ObjectNode response = MAPPER.createObjectNode();
            response.set("offerIds", idArray(offers.publicOffers()));
            sendJson(exchange, 200, response);
        });
    }

    public void offersSent(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Principal principal = validator.principal(pathParam(exchange, "principal"), "principal");

            ObjectNode response = MAPPER.createObjectNode();
            response.put("principal", principal.id());
            response.set("offerIds", idArray(offers.sentBy(principal)));
            sendJson(exchange, 200, response);
        });
    }

    public void offersReceived(HttpServerExchange exchange) {
        handle(exchange, () -> {
            Principal principal = validator.principal(pathParam(exchange, "principal"), "principal");

            ObjectNode response = MAPPER.createObjectNode();
            response.put("principal", principal.id());
            response.set("offerIds", idArray(offers.receivedBy(principal)));
            sendJson(exchange, 200, response);
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * GET /api/events?afterSeq=0&limit=100 - One page of the event log, oldest first.
     */
    public void events(HttpServerExchange exchange) {
        handle(exchange, () -> {
            long afterSeq = validator.nonNegative(queryParam(exchange, "afterSeq"), "afterSeq", 0);
            long limit = validator.nonNegative(queryParam(exchange, "limit"), "limit", eventPageLimit);

            List<LedgerEvent> page = eventService.listAfterSeq(afterSeq, (int) Math.min(limit, eventPageLimit));

            ObjectNode response = MAPPER.createObjectNode();
            response.set("events", MAPPER.valueToTree(page));
            response.put("latestSeq", eventService.currentSeq());
            sendJson(exchange, 200, response);
        });
    }

    /**
     * GET /api/assets/{assetId}/events - Every event for one asset, including after retraction.
     */
    public void assetHistory(HttpServerExchange exchange) {
        handle(exchange, () -> {
            long assetId = validator.id(pathParam(exchange, "assetId"), "assetId");

            ObjectNode response = MAPPER.createObjectNode();
            response.put("assetId", assetId);
            response.set("events", MAPPER.valueToTree(eventService.listForAsset(assetId)));
            sendJson(exchange, 200, response);
        });
    }

    /**
     * GET /api/offers/{offerId}/events - Offer lifecycle plus the ownership moves it settled.
     */
    public void offerHistory(HttpServerExchange exchange) {
        handle(exchange, () -> {
            long offerId = validator.id(pathParam(exchange, "offerId"), "offerId");

            ObjectNode response = MAPPER.createObjectNode();
            response.put("offerId", offerId);
            response.set("events", MAPPER.valueToTree(eventService.listForOffer(offerId)));
            sendJson(exchange, 200, response);
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════════════

    private enum Transition { CANCEL, ACCEPT, DECLINE }

    private void transition(HttpServerExchange exchange, Transition transition) {
        Principal caller = authenticate(exchange);
        if (caller == null) return;

        handle(exchange, () -> {
            long offerId = validator.id(pathParam(exchange, "offerId"), "offerId");
            switch (transition) {
                case CANCEL -> offers.cancel(caller, offerId);
                case ACCEPT -> offers.accept(caller, offerId);
                case DECLINE -> offers.decline(caller, offerId);
            }

            TradeOffer updated = offers.get(offerId)
                .orElseThrow(() -> new IllegalStateException("Offer vanished after transition: " + offerId));
            sendJson(exchange, 200, MAPPER.valueToTree(updated));
        });
    }

    @FunctionalInterface
    private interface Action {
        void run() throws Exception;
    }

    /**
     * Run a handler body, mapping failures to JSON error responses.
     */
    private void handle(HttpServerExchange exchange, Action action) {
        try {
            action.run();
        } catch (LedgerException e) {
            error(exchange, e.getCode().getHttpStatus(), e.getCode().name(), e.getMessage());
        } catch (IllegalArgumentException | JsonProcessingException e) {
            error(exchange, 400, "BAD_REQUEST", e.getMessage());
        } catch (Exception e) {
            log.error("Error handling {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                e.getMessage(), e);
            error(exchange, 500, "INTERNAL", "Internal server error");
        }
    }

    /**
     * Resolve the calling principal, or answer 401 and return null.
     */
    private Principal authenticate(HttpServerExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst(PRINCIPAL_HEADER);
        if (header == null || !validator.isValidPrincipal(header.trim())) {
            error(exchange, 401, "UNAUTHENTICATED", "Missing or malformed " + PRINCIPAL_HEADER + " header");
            return null;
        }
        return Principal.of(header.trim());
    }

    private static JsonNode readBody(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        JsonNode json = MAPPER.readTree(body);
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return json;
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return node.asText();
    }

    /**
     * Read an id array; non-integral entries come back as null for the validator to reject.
     */
    private static List<Long> ids(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException(field + " must be an array");
        }
        List<Long> ids = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            ids.add(item.isIntegralNumber() && item.canConvertToLong() ? item.longValue() : null);
        }
        return ids;
    }

    private static ArrayNode idArray(Collection<Long> ids) {
        ArrayNode array = MAPPER.createArrayNode();
        ids.forEach(array::add);
        return array;
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        return exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get(name);
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values != null ? values.peekFirst() : null;
    }

    private static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void error(HttpServerExchange exchange, int status, String code, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_ERROR, code);
        body.put(JSON_MESSAGE, message);
        sendJson(exchange, status, body);
    }
}
