package com.kumc.anam.client.http;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.net.HttpCookie;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keeps the cookies the portal hands out and replays them on later calls of the same session.
 * One jar per {@link RestPortalClient}; never shared.
 */
class SessionCookieJar implements ClientHttpRequestInterceptor {

    private final Map<String, String> cookies = new LinkedHashMap<>();

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        if (!cookies.isEmpty()) {
            request.getHeaders().set(HttpHeaders.COOKIE, cookieHeader());
        }
        ClientHttpResponse response = execution.execute(request, body);
        List<String> setCookies = response.getHeaders().get(HttpHeaders.SET_COOKIE);
        if (setCookies != null) {
            setCookies.forEach(this::store);
        }
        return response;
    }

    boolean isEmpty() {
        return cookies.isEmpty();
    }

    void clear() {
        cookies.clear();
    }

    private void store(String header) {
        try {
            for (HttpCookie cookie : HttpCookie.parse(header)) {
                if (cookie.getMaxAge() == 0) {
                    cookies.remove(cookie.getName());
                } else {
                    cookies.put(cookie.getName(), cookie.getValue());
                }
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unparseable Set-Cookie header from portal", e);
        }
    }

    private String cookieHeader() {
        return cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
