package com.guildhub.gateway.kafka;

import com.guildhub.core.msg.PublishRequest;
import com.guildhub.core.util.BytesUtils;
import com.guildhub.core.util.JsonUtils;
import com.guildhub.gateway.broadcast.PublishRequestRouter;
import com.guildhub.gateway.config.GatewayConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Consumes {@link PublishRequest}s from Kafka and hands them to the {@link PublishRequestRouter}.
 * <p>
 * Every gateway node must see every event, so each node joins its own consumer group
 * ({@code gateway-<nodeId>}) and starts from the latest offset: events published while a node was
 * down concern connections that no longer exist.
 * </p>
 */
public class KafkaEventConsumer implements IEventBusConsumer {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventConsumer.class);

    private final GatewayConfig config;
    private final PublishRequestRouter router;

    private Disposable subscription;

    public KafkaEventConsumer(GatewayConfig config, PublishRequestRouter router) {
        this.config = config;
        this.router = router;
    }

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            Map<String, Object> consumerProps = new HashMap<>();
            consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
            consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "gateway-" + config.getNodeId());
            consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
            consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

            ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                .subscription(Collections.singleton(config.getEventsTopic()));

            subscription = listen(KafkaReceiver.create(receiverOptions)).subscribe();
            log.info("Node {} consuming publish requests from {}", config.getNodeId(), config.getEventsTopic());
        });
    }

    private Flux<Integer> listen(KafkaReceiver<String, String> receiver) {
        // In order: events for one audience must not overtake each other
        return receiver.receive()
            .concatMap(this::handle)
            .onErrorContinue((err, obj) -> log.error("Error in publish request consumer loop", err));
    }

    private Mono<Integer> handle(ReceiverRecord<String, String> record) {
        PublishRequest request;
        try {
            request = JsonUtils.readValue(record.value(), PublishRequest.class);
        } catch (RuntimeException e) {
            log.error("Skipping malformed publish request at offset {} ({} bytes)",
                record.offset(), BytesUtils.utf8Length(record.value()), e);
            record.receiverOffset().acknowledge();
            return Mono.empty();
        }

        return router.route(request)
            .doOnNext(delivered -> log.debug("Publish request scope={} op={} queued to {} connection(s)",
                request.getScope(), request.getEvent().getOp(), delivered))
            .onErrorResume(err -> {
                log.warn("Rejected publish request at offset {}: {}", record.offset(), err.getMessage());
                return Mono.empty();
            })
            .doFinally(signal -> record.receiverOffset().acknowledge());
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (subscription != null) {
                subscription.dispose();
            }
            log.info("Publish request consumer stopped");
        });
    }
}
