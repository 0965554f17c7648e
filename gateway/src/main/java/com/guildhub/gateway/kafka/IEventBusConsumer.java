package com.guildhub.gateway.kafka;

import reactor.core.publisher.Mono;

/**
 * Source of publish requests from domain services running outside the gateway.
 */
public interface IEventBusConsumer {

    /**
     * Subscribes to the events topic.
     *
     * @return Mono completing when the consumer is subscribed
     */
    Mono<Void> start();

    /**
     * Stops consuming.
     *
     * @return Mono completing when stopped
     */
    Mono<Void> stop();
}
