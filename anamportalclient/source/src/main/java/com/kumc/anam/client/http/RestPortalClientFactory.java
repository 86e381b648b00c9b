package com.kumc.anam.client.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kumc.anam.client.PortalClient;
import com.kumc.anam.client.PortalClientFactory;
import com.kumc.anam.client.PortalCredentials;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Builds one {@link RestPortalClient} per call, each with a fresh {@link RestTemplate}
 * and cookie jar. No connection pooling.
 */
public class RestPortalClientFactory implements PortalClientFactory {

    private final PortalClientSettings settings;
    private final ObjectMapper objectMapper;

    public RestPortalClientFactory(PortalClientSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    @Override
    public PortalClient create(PortalCredentials credentials) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) settings.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) settings.getReadTimeout().toMillis());

        SessionCookieJar cookieJar = new SessionCookieJar();
        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.setInterceptors(List.of(cookieJar));

        return new RestPortalClient(credentials, settings, restTemplate, cookieJar, objectMapper);
    }
}
