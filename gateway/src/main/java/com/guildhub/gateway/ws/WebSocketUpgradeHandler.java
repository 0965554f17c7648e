package com.guildhub.gateway.ws;

import com.guildhub.core.presence.PresenceStatus;
import com.guildhub.gateway.auth.AuthenticatedUser;
import com.guildhub.gateway.auth.MembershipProvider;
import com.guildhub.gateway.auth.TokenValidator;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.drain.DrainService;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.presence.PresenceTracker;
import com.guildhub.gateway.presence.UserStatusStore;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Authenticates an upgrade request and, if admitted, hands the socket to the
 * {@link WebSocketHandler}.
 * <p>
 * Rejections happen before the upgrade, as plain HTTP responses: 503 while draining, 401 for a
 * missing or invalid token, 403 for a banned user. A failing membership or status lookup does not
 * reject the user; they connect with no servers or with the default status.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final GatewayConfig config;
    private final WebSocketHandler wsHandler;
    private final TokenValidator tokenValidator;
    private final MembershipProvider membershipProvider;
    private final UserStatusStore statusStore;
    private final PresenceTracker presenceTracker;
    private final DrainService drainService;
    private final MetricsService metricsService;

    public WebSocketUpgradeHandler(GatewayConfig config,
                                   WebSocketHandler wsHandler,
                                   TokenValidator tokenValidator,
                                   MembershipProvider membershipProvider,
                                   UserStatusStore statusStore,
                                   PresenceTracker presenceTracker,
                                   DrainService drainService,
                                   MetricsService metricsService) {
        this.config = config;
        this.wsHandler = wsHandler;
        this.tokenValidator = tokenValidator;
        this.membershipProvider = membershipProvider;
        this.statusStore = statusStore;
        this.presenceTracker = presenceTracker;
        this.drainService = drainService;
        this.metricsService = metricsService;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (drainService.isDraining()) {
            log.warn("Rejecting new WebSocket connection - node is draining");
            return reject(res, 503, "draining", "Service unavailable - node is draining");
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        String token = Stream.ofNullable(decoder.parameters().get("token"))
            .flatMap(Collection::stream).findFirst()
            .orElse("");

        if (token.isBlank()) {
            return reject(res, 401, "unauthorized", "missing token");
        }

        return tokenValidator.validate(token)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(user -> {
                if (user.isEmpty()) {
                    return reject(res, 401, "unauthorized", "invalid token");
                }
                if (user.get().isBanned()) {
                    log.info("Rejecting banned user {}", user.get().getUserId());
                    return reject(res, 403, "banned", "banned");
                }
                return admit(user.get(), res);
            })
            .onErrorResume(err -> {
                log.error("Token validation failed", err);
                return reject(res, 500, "error", "internal error");
            });
    }

    private Mono<Void> admit(AuthenticatedUser user, HttpServerResponse res) {
        String userId = user.getUserId();

        Mono<Set<String>> servers = membershipProvider.serverIdsOf(userId)
            .collect(Collectors.toSet())
            .onErrorResume(err -> {
                log.warn("Failed to load servers of user {}, connecting with none: {}", userId, err.getMessage());
                return Mono.just(Set.of());
            });

        Mono<PresenceStatus> status = statusStore.loadStatus(userId)
            .defaultIfEmpty(PresenceStatus.ONLINE)
            .onErrorResume(err -> {
                log.warn("Failed to load stored status of user {}, using online: {}", userId, err.getMessage());
                return Mono.just(PresenceStatus.ONLINE);
            });

        return Mono.zip(servers, status)
            .flatMap(tuple -> {
                presenceTracker.restorePreference(userId, tuple.getT2());
                log.debug("Upgrading connection for user {} ({} servers)", userId, tuple.getT1().size());
                return res.sendWebsocket(
                    (inbound, outbound) -> wsHandler.handle(inbound, outbound, userId, tuple.getT1()),
                    WebsocketServerSpec.builder().maxFramePayloadLength(config.getMaxFrameBytes()).build()
                );
            });
    }

    private Mono<Void> reject(HttpServerResponse res, int status, String reason, String body) {
        metricsService.recordRejectedUpgrade(reason);
        return res.status(status).sendString(Mono.just(body)).then();
    }
}
