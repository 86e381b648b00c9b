package com.kumc.anam.gateway.security;

import com.kumc.anam.client.PortalCredentials;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link BearerCredentials} parameters by decoding the bearer token.
 * Any failure surfaces as a {@link TokenException}.
 */
@Component
@RequiredArgsConstructor
public class BearerCredentialsResolver implements HandlerMethodArgumentResolver {

    private static final String BEARER_PREFIX = "bearer ";

    private final TokenService tokenService;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(BearerCredentials.class)
                && PortalCredentials.class.equals(parameter.getParameterType());
    }

    @Override
    public PortalCredentials resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String token = extractToken(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            throw new InvalidTokenException("No bearer token provided");
        }
        return tokenService.decode(token);
    }

    private String extractToken(String authHeader) {
        if (authHeader == null || authHeader.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
