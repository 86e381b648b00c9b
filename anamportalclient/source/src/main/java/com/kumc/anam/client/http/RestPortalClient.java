package com.kumc.anam.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kumc.anam.client.PortalClient;
import com.kumc.anam.client.PortalClientException;
import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.client.PortalSignInException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PortalClient} over the portal's JSON API.
 * <p>
 * The session lives in the cookies set at sign-in. Each instance owns its own
 * {@link RestTemplate} and cookie jar, so nothing leaks between callers.
 */
public class RestPortalClient implements PortalClient {

    private static final Logger log = LoggerFactory.getLogger(RestPortalClient.class);

    private static final List<String> FAILURE_RESULTS = List.of("fail", "failure", "error", "false", "n");
    private static final List<String> MESSAGE_FIELDS = List.of("message", "msg", "resultMsg", "errorMessage");

    private final PortalCredentials credentials;
    private final PortalClientSettings settings;
    private final RestTemplate restTemplate;
    private final SessionCookieJar cookieJar;
    private final ObjectMapper objectMapper;

    private boolean signedIn;
    private boolean closed;

    RestPortalClient(
            PortalCredentials credentials,
            PortalClientSettings settings,
            RestTemplate restTemplate,
            SessionCookieJar cookieJar,
            ObjectMapper objectMapper) {
        this.credentials = credentials;
        this.settings = settings;
        this.restTemplate = restTemplate;
        this.cookieJar = cookieJar;
        this.objectMapper = objectMapper;
    }

    @Override
    public void signIn() {
        ensureOpen();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("memId", credentials.getIdentifier());
        body.put("memPwd", credentials.getSecret());

        log.debug("Signing in to portal: memId={}", credentials.getIdentifier());
        JsonNode response;
        try {
            response = exchange("signIn", settings.getPaths().getSignIn(), body);
        } catch (PortalClientException e) {
            throw new PortalSignInException(e.getMessage(), e);
        }

        String failure = failureMessage(response);
        if (failure != null) {
            throw new PortalSignInException(failure);
        }
        if (cookieJar.isEmpty()) {
            throw new PortalSignInException("Portal did not establish a session");
        }
        signedIn = true;
        log.info("Portal sign-in succeeded: memId={}", credentials.getIdentifier());
    }

    @Override
    public JsonNode getInfo() {
        return query("getInfo", settings.getPaths().getMemberInfo(), Map.of());
    }

    @Override
    public JsonNode getReservations(String hpCd, int apstYmd, int apfnYmd) {
        return query("getReservations", settings.getPaths().getReservations(),
                params("hpCd", hpCd, "apstYmd", apstYmd, "apfnYmd", apfnYmd));
    }

    @Override
    public JsonNode getHealthCheckResult(String hpCd, int strtYmd, int fnshYmd) {
        return query("getHealthCheckResult", settings.getPaths().getHealthCheckResults(),
                params("hpCd", hpCd, "strtYmd", strtYmd, "fnshYmd", fnshYmd));
    }

    @Override
    public JsonNode getMedicationPrescriptionHistory(String hpCd, int ordrYmd1, int ordrYmd2) {
        return query("getMedicationPrescriptionHistory", settings.getPaths().getMedicationPrescriptions(),
                params("hpCd", hpCd, "ordrYmd1", ordrYmd1, "ordrYmd2", ordrYmd2));
    }

    @Override
    public JsonNode getAmbulatoryCareHistory(String hpCd, int inqrStrtYmd, int inqrFnshYmd, int inqrDvsnCd) {
        return query("getAmbulatoryCareHistory", settings.getPaths().getAmbulatoryCareHistory(),
                params("hpCd", hpCd, "inqrStrtYmd", inqrStrtYmd, "inqrFnshYmd", inqrFnshYmd,
                        "inqrDvsnCd", inqrDvsnCd));
    }

    @Override
    public JsonNode getHospitalizationAndDischargeHistory(
            String hpCd, int inqrStrtYmd, int inqrFnshYmd, int inqrDvsnCd) {
        return query("getHospitalizationAndDischargeHistory", settings.getPaths().getHospitalizationHistory(),
                params("hpCd", hpCd, "inqrStrtYmd", inqrStrtYmd, "inqrFnshYmd", inqrFnshYmd,
                        "inqrDvsnCd", inqrDvsnCd));
    }

    @Override
    public JsonNode getPayedList(String hpCd, int strtYmd, int fnshYmd, String codvCd) {
        return query("getPayedList", settings.getPaths().getPayedList(),
                params("hpCd", hpCd, "strtYmd", strtYmd, "fnshYmd", fnshYmd, "codvCd", codvCd));
    }

    @Override
    public JsonNode getPayedDetail(String hpCd, long mdrpNo) {
        return query("getPayedDetail", settings.getPaths().getPayedDetail(),
                params("hpCd", hpCd, "mdrpNo", mdrpNo));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        signedIn = false;
        cookieJar.clear();
        log.debug("Portal session closed: memId={}", credentials.getIdentifier());
    }

    private JsonNode query(String operation, String path, Map<String, Object> params) {
        ensureOpen();
        if (!signedIn) {
            throw new PortalClientException("Not signed in to portal: call signIn() before " + operation);
        }
        JsonNode response = exchange(operation, path, params);
        String failure = failureMessage(response);
        if (failure != null) {
            throw new PortalClientException(failure);
        }
        JsonNode data = response.get("data");
        return data != null ? data : response;
    }

    private JsonNode exchange(String operation, String path, Map<String, Object> body) {
        String url = settings.getBaseUrl() + path;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException e) {
            throw new PortalClientException(String.format("Portal %s failed: HTTP %d",
                    operation, e.getStatusCode().value()), e);
        } catch (RestClientException | IllegalStateException e) {
            throw new PortalClientException(String.format("Portal %s failed: %s", operation, e.getMessage()), e);
        }

        String raw = response.getBody();
        if (raw == null || raw.isBlank()) {
            throw new PortalClientException(String.format("Portal %s returned an empty body", operation));
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new PortalClientException(String.format("Portal %s returned an unreadable body", operation), e);
        }
    }

    /**
     * Message for a response the portal marks as failed, or null when it succeeded.
     */
    private String failureMessage(JsonNode response) {
        if (!response.isObject()) {
            return null;
        }
        boolean failed = false;
        JsonNode success = response.get("success");
        if (success != null && success.isBoolean() && !success.asBoolean()) {
            failed = true;
        }
        JsonNode result = response.get("result");
        if (result != null) {
            if (result.isBoolean()) {
                failed |= !result.asBoolean();
            } else if (result.isTextual()) {
                failed |= FAILURE_RESULTS.contains(result.asText().toLowerCase());
            }
        }
        if (!failed) {
            return null;
        }
        for (String field : MESSAGE_FIELDS) {
            JsonNode message = response.get(field);
            if (message != null && message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
        }
        return "Portal rejected the request";
    }

    private void ensureOpen() {
        if (closed) {
            throw new PortalClientException("Portal session already closed");
        }
    }

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
