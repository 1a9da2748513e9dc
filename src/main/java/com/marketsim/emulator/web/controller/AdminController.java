package com.marketsim.emulator.web.controller;

import com.marketsim.emulator.core.account.AccountService;
import com.marketsim.emulator.core.engine.MarketEngine;
import com.marketsim.emulator.core.engine.NewsShockService;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderStatus;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.order.OrderService;
import com.marketsim.emulator.core.order.PlaceOrderCommand;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.regime.RegimeController;
import com.marketsim.emulator.core.support.Numbers;
import com.marketsim.emulator.web.dto.AccountDto;
import com.marketsim.emulator.web.dto.CreateAccountRequest;
import com.marketsim.emulator.web.dto.CreateOrderRequest;
import com.marketsim.emulator.web.dto.EngineStatusDto;
import com.marketsim.emulator.web.dto.FillDto;
import com.marketsim.emulator.web.dto.NewsShockRequest;
import com.marketsim.emulator.web.dto.NewsShockResponse;
import com.marketsim.emulator.web.dto.OrderDto;
import com.marketsim.emulator.web.dto.PositionDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AdminController {

    private static final int RECENT_TRADES = 20;

    private final OrderService orderService;
    private final AccountService accountService;
    private final NewsShockService newsShockService;
    private final MarketEngine marketEngine;
    private final RegimeController regimeController;
    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;

    @PostMapping("/orders")
    public ResponseEntity<OrderDto> createOrder(@RequestBody CreateOrderRequest request) {
        log.info("REST CreateOrder: user={} {} {} {} x{} limit={} stop={} trail={}",
                request.getUserId(), request.getType(), request.getSide(), request.getTicker(),
                request.getQuantity(), request.getLimitPrice(), request.getStopPrice(), request.getTrailPct());
        try {
            Order order = orderService.placeOrder(PlaceOrderCommand.builder()
                    .userId(request.getUserId())
                    .ticker(request.getTicker())
                    .type(request.getType())
                    .side(request.getSide())
                    .quantity(request.getQuantity())
                    .limitPrice(request.getLimitPrice())
                    .stopPrice(request.getStopPrice())
                    .trailPct(request.getTrailPct())
                    .ocoId(request.getOcoId())
                    .build());
            return ResponseEntity.ok(OrderDto.from(order));
        } catch (IllegalArgumentException e) {
            log.warn("REST CreateOrder: rejected - {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @DeleteMapping("/orders/{id}")
    public ResponseEntity<OrderDto> cancelOrder(@PathVariable String id) {
        log.info("REST CancelOrder: id={}", id);
        UUID orderId;
        try {
            orderId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        Optional<Order> order = orderService.cancelOrder(orderId);
        if (order.isEmpty()) {
            log.warn("REST CancelOrder: order {} not found", id);
            return ResponseEntity.notFound().build();
        }
        if (order.get().getStatus() != OrderStatus.CANCELLED) {
            log.warn("REST CancelOrder: order {} already {}", id, order.get().getStatus());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(OrderDto.from(order.get()));
        }
        return ResponseEntity.ok(OrderDto.from(order.get()));
    }

    @GetMapping("/orders")
    public List<OrderDto> getOrders(@RequestParam String userId) {
        List<Order> orders = orderService.ordersOf(userId);
        log.debug("REST GetOrders: user={} found {} orders", userId, orders.size());
        return orders.stream()
                .map(OrderDto::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/accounts")
    public ResponseEntity<AccountDto> createAccount(@RequestBody CreateAccountRequest request) {
        log.info("REST CreateAccount: user={} cash={}", request.getUserId(), request.getCash());
        try {
            return accountService.createAccount(request.getUserId(), request.getCash())
                    .map(account -> ResponseEntity.ok(mapAccount(account)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
        } catch (IllegalArgumentException e) {
            log.warn("REST CreateAccount: rejected - {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/accounts/{userId}")
    public ResponseEntity<AccountDto> getAccount(@PathVariable String userId) {
        return accountService.findAccount(userId)
                .map(account -> ResponseEntity.ok(mapAccount(account)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/news-shock")
    public ResponseEntity<NewsShockResponse> newsShock(@RequestBody NewsShockRequest request) {
        log.info("REST NewsShock: ticker={} impact={}", request.getTicker(), request.getImpactPct());
        if (request.getTicker() == null || request.getImpactPct() == null) {
            return ResponseEntity.badRequest().build();
        }
        if (!catalog.contains(request.getTicker())) {
            return ResponseEntity.notFound().build();
        }
        try {
            double applied = newsShockService.applyNewsShock(request.getTicker(), request.getImpactPct());
            return ResponseEntity.ok(NewsShockResponse.builder()
                    .ticker(request.getTicker())
                    .requestedImpactPct(request.getImpactPct())
                    .appliedImpactPct(applied)
                    .regime(regimeController.current())
                    .build());
        } catch (IllegalArgumentException e) {
            log.warn("REST NewsShock: rejected - {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @PostMapping("/engine/pause")
    public EngineStatusDto pause(@RequestParam(defaultValue = "manual") String reason) {
        marketEngine.pause(reason);
        return engineStatus();
    }

    @PostMapping("/engine/resume")
    public EngineStatusDto resume() {
        marketEngine.resume();
        return engineStatus();
    }

    @GetMapping("/engine/status")
    public EngineStatusDto engineStatus() {
        return EngineStatusDto.builder()
                .paused(marketEngine.isPaused())
                .pauseReason(marketEngine.getPauseReason())
                .tickCount(marketEngine.getTickCount())
                .regime(regimeController.current())
                .build();
    }

    private AccountDto mapAccount(Account account) {
        BigDecimal equity = account.getCash();
        List<PositionDto> positions = new ArrayList<>();
        for (Position position : accountService.positions(account.getUserId())) {
            Optional<PriceState> state = priceStates.get(position.getTicker());
            BigDecimal qty = BigDecimal.valueOf(position.getQuantity());
            PositionDto.PositionDtoBuilder dto = PositionDto.builder()
                    .ticker(position.getTicker())
                    .quantity(position.getQuantity())
                    .averageCost(position.getAverageCost())
                    .accruedBorrow(position.getAccruedBorrow());
            if (state.isPresent()) {
                BigDecimal price = Numbers.price(state.get().getPrice());
                BigDecimal marketValue = Numbers.money(qty.multiply(price));
                equity = equity.add(marketValue);
                dto.lastPrice(state.get().getPrice())
                        .marketValue(marketValue)
                        .unrealizedPnl(Numbers.money(price.subtract(position.getAverageCost()).multiply(qty)));
            }
            positions.add(dto.build());
        }
        return AccountDto.builder()
                .userId(account.getUserId())
                .cash(account.getCash())
                .startingCash(account.getStartingCash())
                .equity(Numbers.money(equity))
                .positions(positions)
                .recentTrades(accountService.recentTrades(account.getUserId(), RECENT_TRADES).stream()
                        .map(FillDto::from)
                        .collect(Collectors.toList()))
                .build();
    }
}
