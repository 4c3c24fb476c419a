package com.rabbitresilience.core.infrastructure.messaging;

@FunctionalInterface
public interface DeliveryHandler {

  void onDelivery(Delivery delivery);
}
