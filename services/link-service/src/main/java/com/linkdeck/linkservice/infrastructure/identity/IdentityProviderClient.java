package com.linkdeck.linkservice.infrastructure.identity;

import com.linkdeck.linkservice.config.IdentityProviderProperties;
import com.linkdeck.observability.SpanHelper;
import io.opentelemetry.api.trace.SpanKind;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Asks the identity provider whether a cookie header carries a valid session.
 *
 * <p>The cookie header is forwarded verbatim. A 4xx answer is still read as a session verdict;
 * a missing URL, transport failure, 5xx or unreadable body raises
 * {@link IdentityProviderException}. Each call runs in a CLIENT span.
 */
public class IdentityProviderClient {

    private final RestClient restClient;
    private final IdentityProviderProperties properties;
    private final SpanHelper spans;

    public IdentityProviderClient(RestClient restClient, IdentityProviderProperties properties, SpanHelper spans) {
        this.restClient = restClient;
        this.properties = properties;
        this.spans = spans;
    }

    public boolean isConfigured(SessionEndpoint endpoint) {
        String url = urlFor(endpoint);
        return url != null && !url.isBlank();
    }

    public SessionCheckResponse check(SessionEndpoint endpoint, String cookieHeader) {
        if (!isConfigured(endpoint)) {
            throw new IdentityProviderException(
                    "Identity provider " + endpoint.label() + " session endpoint is not configured");
        }
        String url = urlFor(endpoint);
        SessionCheckResponse response;
        try {
            response = spans.inSpan("identity.session.check", SpanKind.CLIENT,
                    Map.of("idp.endpoint", endpoint.label()),
                    () -> restClient.get()
                            .uri(url)
                            .header(HttpHeaders.COOKIE, cookieHeader == null ? "" : cookieHeader)
                            .accept(MediaType.APPLICATION_JSON)
                            .header(HttpHeaders.USER_AGENT, properties.userAgent())
                            .retrieve()
                            .onStatus(HttpStatusCode::is4xxClientError, (request, resp) -> { })
                            .body(SessionCheckResponse.class));
        } catch (RestClientException | IllegalArgumentException e) {
            throw new IdentityProviderException(
                    "Identity provider " + endpoint.label() + " check failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new IdentityProviderException(
                    "Identity provider " + endpoint.label() + " returned an empty body");
        }
        return response;
    }

    private String urlFor(SessionEndpoint endpoint) {
        return endpoint == SessionEndpoint.PUBLIC ? properties.publicSessionUrl() : properties.adminSessionUrl();
    }
}
