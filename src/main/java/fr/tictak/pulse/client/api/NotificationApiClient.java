package fr.tictak.pulse.client.api;

import com.fasterxml.jackson.databind.JsonNode;
import fr.tictak.pulse.client.connection.TokenProvider;
import fr.tictak.pulse.client.resilience.OfflineQueueEntry;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import java.util.List;
import java.util.Optional;

/**
 * Blocking REST calls to the notification server. Callers run them through the resilience layer.
 */
public class NotificationApiClient {

    public static final String NOTIFICATIONS = "/api/notifications";
    public static final String PREFERENCES = "/api/notification-preferences";

    private final RestTemplate restTemplate;

    public NotificationApiClient(String baseUrl, TokenProvider tokenProvider) {
        this(createRestTemplate(baseUrl, tokenProvider));
    }

    NotificationApiClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public NotificationPage fetchNotifications(boolean unreadOnly) {
        return restTemplate.getForObject(NOTIFICATIONS + "?unreadOnly={unreadOnly}", NotificationPage.class, unreadOnly);
    }

    public void markAsRead(String notificationId) {
        restTemplate.exchange(readEndpoint(notificationId), HttpMethod.PATCH, null, Void.class);
    }

    public void markAllAsRead() {
        restTemplate.postForLocation(NOTIFICATIONS + "/read-all", null);
    }

    public void deleteNotification(String notificationId) {
        restTemplate.delete(NOTIFICATIONS + "/{id}", notificationId);
    }

    public List<PreferenceItem> fetchPreferences() {
        PreferenceItem[] preferences = restTemplate.getForObject(PREFERENCES, PreferenceItem[].class);
        return preferences != null ? List.of(preferences) : List.of();
    }

    public PreferenceItem updatePreference(String type, PreferenceItem patch) {
        return restTemplate.patchForObject(preferenceEndpoint(type), patch, PreferenceItem.class);
    }

    /**
     * Sends a request that was deferred in the offline queue.
     */
    public void replay(OfflineQueueEntry entry) {
        JsonNode payload = entry.payload();
        HttpEntity<?> body = null;
        if (payload != null && !payload.isNull()) {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            body = new HttpEntity<>(payload, headers);
        }
        restTemplate.exchange(entry.endpoint(), HttpMethod.valueOf(entry.method()), body, Void.class);
    }

    public static String readEndpoint(String notificationId) {
        return NOTIFICATIONS + "/" + notificationId + "/read";
    }

    public static String deleteEndpoint(String notificationId) {
        return NOTIFICATIONS + "/" + notificationId;
    }

    public static String preferenceEndpoint(String type) {
        return PREFERENCES + "/" + type;
    }

    private static RestTemplate createRestTemplate(String baseUrl, TokenProvider tokenProvider) {
        RestTemplate template = new RestTemplate(new JdkClientHttpRequestFactory());
        template.setUriTemplateHandler(new DefaultUriBuilderFactory(baseUrl));
        template.getInterceptors().add((request, body, execution) -> {
            Optional<String> token = tokenProvider.currentToken();
            token.ifPresent(request.getHeaders()::setBearerAuth);
            return execution.execute(request, body);
        });
        return template;
    }
}
