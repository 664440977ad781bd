package io.schedula.core.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.schedula.core.bus.ClientUpdate;
import io.schedula.core.bus.MessageBus;
import io.schedula.core.error.SchedulaException;
import io.schedula.core.error.UnauthorizedException;
import io.schedula.core.error.ValidationException;
import io.schedula.core.event.Event;
import io.schedula.core.event.EventRegistry;
import io.schedula.core.identity.Principal;
import io.schedula.core.identity.PrincipalResolver;
import io.schedula.core.job.JobHistoryService;
import io.schedula.core.job.JobLaunchMultiplexer;
import io.schedula.core.observability.ActivityService;
import io.schedula.core.request.RequestContext;
import io.schedula.core.store.ListPage;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON API over the coordinator. Every {@code /api/app/*} call resolves the caller from the
 * {@code X-API-Key} or {@code X-Session-User} header, merges query and body parameters,
 * and answers {@code {"code":0,...}} or {@code {"code":"<error>","description":"..."}}.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS = new TypeReference<>() {
    };

    private final String host;
    private final int requestedPort;
    private final EventRegistry registry;
    private final JobLaunchMultiplexer multiplexer;
    private final JobHistoryService historyService;
    private final PrincipalResolver principalResolver;
    private final ActivityService activityService;
    private final MessageBus messageBus;
    private final Clock clock;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;

    private final ExecutorService executor;
    private final AtomicBoolean running;
    private final Map<String, WebSocketChannel> clients;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        int port,
        String host,
        EventRegistry registry,
        JobLaunchMultiplexer multiplexer,
        JobHistoryService historyService,
        PrincipalResolver principalResolver,
        ActivityService activityService,
        MessageBus messageBus,
        Clock clock,
        Duration requestTimeout
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer must not be null");
        this.historyService = Objects.requireNonNull(historyService, "historyService must not be null");
        this.principalResolver = Objects.requireNonNull(principalResolver, "principalResolver must not be null");
        this.activityService = activityService;
        this.messageBus = messageBus;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.requestTimeout = requestTimeout == null ? Duration.ZERO : requestTimeout;

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.executor = Executors.newCachedThreadPool();
        this.running = new AtomicBoolean(false);
        this.clients = new ConcurrentHashMap<>();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        HttpHandler wsHandler = Handlers.websocket(this::onWebSocketConnect);
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/api/app/get_schedule", api("GET", this::getSchedule))
            .addExactPath("/api/app/get_event", api("GET", this::getEvent))
            .addExactPath("/api/app/create_event", api("POST", this::createEvent))
            .addExactPath("/api/app/update_event", api("POST", this::updateEvent))
            .addExactPath("/api/app/delete_event", api("POST", this::deleteEvent))
            .addExactPath("/api/app/run_event", api("POST", this::runEvent))
            .addExactPath("/api/app/get_event_history", api("GET", this::getEventHistory))
            .addExactPath("/api/app/get_history", api("GET", this::getHistory))
            .addExactPath("/api/app/get_activity", api("GET", this::getActivity))
            .addExactPath("/api/app/job_complete", api("POST", this::jobComplete))
            .addExactPath("/ws", wsHandler);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);

        if (messageBus != null) {
            executor.submit(this::pumpBusToClients);
        }
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
        clients.values().forEach(channel -> {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.debug("Failed to close WebSocket channel: {}", e.getMessage());
            }
        });
        clients.clear();
        executor.shutdownNow();
    }

    private Map<String, Object> getSchedule(RequestContext context, Map<String, Object> params) throws IOException {
        ListPage<Event> page = registry.list(intParam(params, "offset", 0), intParam(params, "limit", 50));
        return pageResponse(page);
    }

    private Map<String, Object> getEvent(RequestContext context, Map<String, Object> params) throws IOException {
        return ok("event", registry.get(requireId(params)));
    }

    private Map<String, Object> createEvent(RequestContext context, Map<String, Object> params) throws IOException {
        Event event = registry.create(context, params);
        return ok("id", event.id());
    }

    private Map<String, Object> updateEvent(RequestContext context, Map<String, Object> params) throws IOException {
        Event event = registry.update(context, requireId(params), params);
        return ok("event", event);
    }

    private Map<String, Object> deleteEvent(RequestContext context, Map<String, Object> params) throws IOException {
        registry.delete(context, requireId(params));
        return ok();
    }

    private Map<String, Object> runEvent(RequestContext context, Map<String, Object> params) throws IOException {
        String id = requireId(params);
        Map<String, Object> overrides = new LinkedHashMap<>(params);
        overrides.remove("id");
        List<String> ids = multiplexer.run(context, id, overrides);
        return ok("ids", ids);
    }

    private Map<String, Object> getEventHistory(RequestContext context, Map<String, Object> params) throws IOException {
        String id = requireId(params);
        return pageResponse(historyService.eventHistory(id, intParam(params, "offset", 0), intParam(params, "limit", 100)));
    }

    private Map<String, Object> getHistory(RequestContext context, Map<String, Object> params) throws IOException {
        return pageResponse(historyService.history(intParam(params, "offset", 0), intParam(params, "limit", 50)));
    }

    private Map<String, Object> getActivity(RequestContext context, Map<String, Object> params) throws IOException {
        if (activityService == null) {
            return ok("rows", List.of());
        }
        int limit = Math.max(1, Math.min(1000, intParam(params, "limit", 100)));
        return ok("rows", activityService.recent(limit));
    }

    private Map<String, Object> jobComplete(RequestContext context, Map<String, Object> params) throws IOException {
        Object jobId = params.get("id");
        if (jobId == null || String.valueOf(jobId).isBlank()) {
            throw new ValidationException("id", "Missing or malformed parameter: id");
        }
        historyService.recordCompletion(params);
        return ok();
    }

    private HttpHandler api(String method, ApiCall call) {
        return new HttpHandler() {
            @Override
            public void handleRequest(HttpServerExchange exchange) throws Exception {
                if (exchange.isInIoThread()) {
                    exchange.dispatch(this);
                    return;
                }
                if (!method.equalsIgnoreCase(exchange.getRequestMethod().toString())) {
                    sendJson(exchange, 405, error("method_not_allowed", "Method not allowed"));
                    return;
                }
                try {
                    Principal principal = principalResolver.resolve(header(exchange, "X-API-Key"), header(exchange, "X-Session-User"))
                        .orElseThrow(() -> new UnauthorizedException("No valid API key or session user"));
                    RequestContext context = RequestContext.of(principal, clock, requestTimeout);
                    Map<String, Object> params = readParams(exchange);
                    sendJson(exchange, 200, call.handle(context, params));
                } catch (SchedulaException e) {
                    sendJson(exchange, e.httpStatus(), error(e.code(), e.getMessage()));
                } catch (Exception e) {
                    LOG.warn("Request {} failed", exchange.getRequestPath(), e);
                    sendJson(exchange, 500, error("internal", e.getMessage() == null ? "internal_error" : e.getMessage()));
                }
            }
        };
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, error("method_not_allowed", "Method not allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void onWebSocketConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String clientId = UUID.randomUUID().toString();
        clients.put(clientId, channel);
        channel.getCloseSetter().set(closeChannel -> clients.remove(clientId));
        channel.resumeReceives();
    }

    private void pumpBusToClients() {
        while (running.get()) {
            try {
                var next = messageBus.poll();
                if (next.isPresent()) {
                    broadcast(next.get());
                    continue;
                }
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void broadcast(ClientUpdate update) {
        String frame;
        try {
            frame = mapper.writeValueAsString(update);
        } catch (IOException e) {
            LOG.warn("Failed to encode client update {}: {}", update.type(), e.getMessage());
            return;
        }
        for (WebSocketChannel channel : clients.values()) {
            WebSockets.sendText(frame, channel, null);
        }
    }

    private Map<String, Object> readParams(HttpServerExchange exchange) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<String>> entry : exchange.getQueryParameters().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                params.put(entry.getKey(), entry.getValue().peekFirst());
            }
        }
        JsonNode body = readJsonBody(exchange);
        if (body.isObject()) {
            params.putAll(mapper.convertValue(body, PARAMS));
        } else if (!body.isMissingNode() && !body.isNull()) {
            throw new ValidationException("body", "Request body must be a JSON object");
        }
        return params;
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(bytes);
        } catch (IOException e) {
            throw new ValidationException("body", "Malformed JSON body");
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private String requireId(Map<String, Object> params) {
        Object id = params.get("id");
        if (id == null || String.valueOf(id).isBlank()) {
            throw new ValidationException("id", "Missing or malformed parameter: id");
        }
        return String.valueOf(id);
    }

    private int intParam(Map<String, Object> params, String key, int fallback) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private Map<String, Object> pageResponse(ListPage<?> page) {
        Map<String, Object> payload = ok("rows", page.items());
        payload.put("list", Map.of("length", page.length()));
        return payload;
    }

    private Map<String, Object> ok() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", 0);
        return payload;
    }

    private Map<String, Object> ok(String key, Object value) {
        Map<String, Object> payload = ok();
        payload.put(key, value);
        return payload;
    }

    private Map<String, Object> error(String code, String description) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("description", description);
        return payload;
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ApiCall {
        Map<String, Object> handle(RequestContext context, Map<String, Object> params) throws IOException;
    }
}
