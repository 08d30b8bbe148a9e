package com.archive.accessions.notification;

/**
 * Best-effort outbound message to a single address. Calls return within a short bounded
 * timeout; failures surface as {@link com.archive.accessions.exception.NotificationException}.
 */
public interface Notifier {

    void send(String address, String subject, String body);
}
