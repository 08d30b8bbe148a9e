package com.archive.accessions.notification;

import com.archive.accessions.config.NotificationProperties;
import com.archive.accessions.exception.NotificationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * {@link Notifier} sending HTML email through the Postmark HTTP API.
 */
@Component
@Slf4j
public class PostmarkNotifier implements Notifier {

    static final String SERVER_TOKEN_HEADER = "X-Postmark-Server-Token";

    private final RestTemplate restTemplate;
    private final NotificationProperties properties;

    public PostmarkNotifier(
        @Qualifier("notificationRestTemplate") RestTemplate restTemplate,
        NotificationProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    record EmailMessage(
        @JsonProperty("From") String from,
        @JsonProperty("To") String to,
        @JsonProperty("Subject") String subject,
        @JsonProperty("HtmlBody") String htmlBody
    ) {}

    @Override
    public void send(String address, String subject, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(SERVER_TOKEN_HEADER, properties.apiKey());

        EmailMessage message = new EmailMessage(properties.senderAddress(), address, subject, body);

        try {
            restTemplate.postForEntity(properties.apiBase() + "/email", new HttpEntity<>(message, headers), String.class);
        } catch (RestClientException e) {
            throw new NotificationException("Email to " + address + " failed: " + e.getMessage(), e);
        }
        log.debug("Email '{}' sent to {}", subject, address);
    }
}
