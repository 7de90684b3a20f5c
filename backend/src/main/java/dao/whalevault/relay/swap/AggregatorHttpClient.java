package dao.whalevault.relay.swap;

import com.fasterxml.jackson.databind.JsonNode;
import dao.whalevault.relay.exception.AggregatorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * JSON over HTTP for the swap aggregators, with failures classified for {@link RetryPolicy}:
 * 429 is rate limiting, 5xx and I/O errors are transient, everything else is permanent.
 */
@Slf4j
@Component
public class AggregatorHttpClient {

    private final RestTemplate restTemplate;

    public AggregatorHttpClient(@Qualifier("aggregatorRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public JsonNode get(String url, Map<String, ?> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
        queryParams.forEach((name, value) -> builder.queryParam(name, value));
        URI uri = builder.encode().build().toUri();
        try {
            return requireBody(restTemplate.getForObject(uri, JsonNode.class), url);
        } catch (RestClientException e) {
            throw classify(url, e);
        }
    }

    public JsonNode post(String url, Object body) {
        try {
            return requireBody(restTemplate.postForObject(url, body, JsonNode.class), url);
        } catch (RestClientException e) {
            throw classify(url, e);
        }
    }

    private static JsonNode requireBody(JsonNode body, String url) {
        if (body == null || body.isNull()) {
            throw AggregatorException.permanent("Empty response from " + url, 502);
        }
        return body;
    }

    static AggregatorException classify(String url, RestClientException e) {
        if (e instanceof HttpStatusCodeException statusError) {
            int status = statusError.getStatusCode().value();
            if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return AggregatorException.rateLimited("Rate limited by " + url);
            }
            if (statusError.getStatusCode().is5xxServerError()) {
                return AggregatorException.transientFailure("Server error " + status + " from " + url, e);
            }
            log.warn("Aggregator rejected request to {}: {} {}", url, status, statusError.getResponseBodyAsString());
            return AggregatorException.permanent("Aggregator error " + status + " from " + url, 502, e);
        }
        if (e instanceof ResourceAccessException) {
            return AggregatorException.transientFailure("Network error calling " + url + ": " + e.getMessage(), e);
        }
        return AggregatorException.permanent("Invalid response from " + url + ": " + e.getMessage(), 502, e);
    }
}
