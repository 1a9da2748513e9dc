package com.marketsim.emulator.web.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketsim.emulator.core.event.FillEvent;
import com.marketsim.emulator.core.event.MarginCallEvent;
import com.marketsim.emulator.core.event.RegimeChangedEvent;
import com.marketsim.emulator.core.event.TickEvent;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.model.TickSnapshot;
import com.marketsim.emulator.web.dto.FillDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Relays engine events to WebSocket clients as {@code {type, data}} JSON. Ticks and regime
 * changes go to everyone; fills and margin calls only to sessions opened with a matching
 * {@code ?userId=} query parameter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketWebSocketHandler extends TextWebSocketHandler {

    static final String TYPE_TICK = "tick";
    static final String TYPE_REGIME = "regime";
    static final String TYPE_FILL = "fill";
    static final String TYPE_MARGIN_CALL = "margin_call";

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String userId = userIdOf(session.getUri());
        sessions.put(session.getId(), new ClientSession(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT), userId));
        log.info("WS: Client connected, sessionId={}, userId={}, total sessions={}",
                session.getId(), userId, sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("WS: Client disconnected, sessionId={}, status={}, remaining sessions={}",
                session.getId(), status, sessions.size());
    }

    @EventListener
    public void handleTick(TickEvent event) {
        if (sessions.isEmpty()) {
            log.trace("WS: No active sessions, skipping tick broadcast");
            return;
        }
        broadcast(TYPE_TICK, new TickMessage(event.getTickNumber(), event.getRegime(), event.getTicks()), null);
    }

    @EventListener
    public void handleRegimeChange(RegimeChangedEvent event) {
        broadcast(TYPE_REGIME, new RegimeMessage(event.getPrevious(), event.getCurrent().getRegime(),
                event.getCurrent().getReason().name(), event.getCurrent().getStartedAt()), null);
    }

    @EventListener
    public void handleFill(FillEvent event) {
        broadcast(TYPE_FILL, FillDto.from(event.getTrade()), event.getTrade().getUserId());
    }

    @EventListener
    public void handleMarginCall(MarginCallEvent event) {
        MarginCallMessage message = new MarginCallMessage(event.getUserId(), event.getEquity(),
                event.getShortExposure(), event.getLiquidations().stream()
                        .map(FillDto::from)
                        .collect(Collectors.toList()));
        broadcast(TYPE_MARGIN_CALL, message, event.getUserId());
    }

    int sessionCount() {
        return sessions.size();
    }

    /**
     * @param userId only sessions of this user receive the message; null for everyone
     */
    private void broadcast(String type, Object data, String userId) {
        if (sessions.isEmpty()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(new WebSocketMessage(type, data));
        } catch (JsonProcessingException e) {
            log.error("WS: Failed to serialize {} message", type, e);
            return;
        }
        TextMessage message = new TextMessage(payload);
        int sent = 0;
        for (ClientSession client : sessions.values()) {
            if (userId != null && !userId.equals(client.userId())) {
                continue;
            }
            WebSocketSession session = client.session();
            if (!session.isOpen()) {
                continue;
            }
            try {
                session.sendMessage(message);
                sent++;
            } catch (IOException | RuntimeException e) {
                log.warn("WS: Failed to send {} to session {}: {}", type, session.getId(), e.getMessage());
            }
        }
        log.trace("WS: Sent {} to {} sessions", type, sent);
    }

    static String userIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("userId");
    }

    private record ClientSession(WebSocketSession session, String userId) {}

    private record WebSocketMessage(String type, Object data) {}

    private record TickMessage(long tick, RegimeType regime, List<TickSnapshot> prices) {}

    private record RegimeMessage(RegimeType previous, RegimeType regime, String reason, Instant since) {}

    private record MarginCallMessage(String userId, BigDecimal equity, BigDecimal shortExposure,
                                     List<FillDto> liquidations) {}
}
