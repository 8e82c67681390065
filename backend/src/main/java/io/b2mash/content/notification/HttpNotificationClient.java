package io.b2mash.content.notification;

import io.b2mash.content.config.NotificationConfig.NotificationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Sends notifications to the notification service over HTTP with a bearer service token. The
 * response body is not read. When delivery is disabled the request is only logged.
 */
@Component
public class HttpNotificationClient implements NotificationClient {

  private static final Logger log = LoggerFactory.getLogger(HttpNotificationClient.class);

  private final NotificationProperties properties;
  private final RestClient restClient;

  public HttpNotificationClient(
      NotificationProperties properties, RestClient.Builder restClientBuilder) {
    this.properties = properties;
    this.restClient =
        restClientBuilder
            .baseUrl(properties.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.serviceToken())
            .build();
  }

  @Override
  public void send(NotificationRequest request) {
    if (!properties.enabled()) {
      log.debug(
          "Notification delivery disabled, dropping type={} userId={}",
          request.type(),
          request.userId());
      return;
    }
    try {
      restClient
          .post()
          .uri("/notifications/send")
          .contentType(MediaType.APPLICATION_JSON)
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException e) {
      throw new NotificationDeliveryException(
          "Failed to send " + request.type().value() + " notification to " + request.userId(), e);
    }
  }
}
