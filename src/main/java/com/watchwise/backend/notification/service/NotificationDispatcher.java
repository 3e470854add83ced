package com.watchwise.backend.notification.service;

/**
 * Delivery boundary. Pairing, sweeps and restriction sync only hand events over;
 * push transport lives behind this interface.
 */
public interface NotificationDispatcher {

    void dispatch(NotificationEvent event);
}
