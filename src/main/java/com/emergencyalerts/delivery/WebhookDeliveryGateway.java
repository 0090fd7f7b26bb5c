package com.emergencyalerts.delivery;

import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.Area;
import com.emergencyalerts.exception.UpstreamUnavailableException;
import com.emergencyalerts.mapper.JsonHelper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs approved alerts to the delivery transport's intake endpoint.
 *
 * <p>Any transport failure (connection refused, timeout, non-2xx) surfaces as
 * {@link UpstreamUnavailableException}. No retry happens here.
 */
@Component
@ConditionalOnProperty(name = "emergency-alerts.delivery.mode", havingValue = "webhook")
public class WebhookDeliveryGateway implements DeliveryGateway {

    private static final Logger log = LoggerFactory.getLogger(WebhookDeliveryGateway.class);

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    @Autowired
    public WebhookDeliveryGateway(
            @Value("${emergency-alerts.delivery.webhook-url}") String webhookUrl,
            @Value("${emergency-alerts.delivery.connect-timeout:PT5S}") Duration connectTimeout,
            @Value("${emergency-alerts.delivery.read-timeout:PT10S}") Duration readTimeout) {
        this(createRestTemplate(connectTimeout, readTimeout), webhookUrl);
    }

    public WebhookDeliveryGateway(RestTemplate restTemplate, String webhookUrl) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new IllegalStateException("emergency-alerts.delivery.webhook-url is required in webhook mode");
        }
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void requestDelivery(Alert alert) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request = new HttpEntity<>(JsonHelper.toJson(toPayload(alert)), headers);
        try {
            restTemplate.postForEntity(webhookUrl, request, String.class);
            log.info("Delivery requested for alert {} via webhook", alert.getId());
        } catch (RestClientException e) {
            log.error("Delivery webhook failed for alert {}: {}", alert.getId(), e.getMessage());
            throw new UpstreamUnavailableException("Delivery transport unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "webhook";
    }

    private Map<String, Object> toPayload(Alert alert) {
        List<Map<String, Object>> areas = new ArrayList<>();
        for (Area area : alert.getAreas()) {
            Map<String, Object> areaPayload = new LinkedHashMap<>();
            areaPayload.put("description", area.getDescription());
            areaPayload.put("regionCode", area.getRegionCode());
            areaPayload.put(
                    "polygon",
                    area.getPolygon().stream()
                            .map(p -> List.of(p.getLongitude(), p.getLatitude()))
                            .toList());
            areas.add(areaPayload);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("headline", alert.getHeadline());
        payload.put("description", alert.getDescription());
        payload.put("severity", alert.getSeverity().name());
        payload.put("channelType", alert.getChannelType().name());
        payload.put("languageCode", alert.getLanguageCode());
        payload.put("expiresAt", alert.getExpiresAt().toString());
        payload.put("areas", areas);
        return payload;
    }

    private static RestTemplate createRestTemplate(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return new RestTemplate(requestFactory);
    }
}
