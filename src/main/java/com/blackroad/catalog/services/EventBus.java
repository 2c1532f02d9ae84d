package com.blackroad.catalog.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;

public class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public enum Topic {
        PRODUCT_ADDED,
        INVENTORY_CHANGED,
        CATALOG_IMPORTED
    }

    private final Map<Topic, List<Consumer<Object>>> subscribers = new EnumMap<>(Topic.class);

    public EventBus() {
        for (Topic t : Topic.values()) {
            subscribers.put(t, new ArrayList<>());
        }
    }

    public void subscribe(Topic topic, Consumer<Object> handler){
        subscribers.get(topic).add(handler);
    }

    /** Un suscriptor que falla no interrumpe a los demás ni a quien publica. */
    public void publish(Topic topic, Object payload){
        for (Consumer<Object> h : subscribers.get(topic)){
            try {
                h.accept(payload);
            } catch (RuntimeException e) {
                log.warn("Subscriber for {} failed on payload {}", topic, payload, e);
            }
        }
    }
}
