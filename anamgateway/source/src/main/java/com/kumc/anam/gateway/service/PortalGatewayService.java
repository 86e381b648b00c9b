package com.kumc.anam.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.kumc.anam.client.PortalClient;
import com.kumc.anam.client.PortalClientFactory;
import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.gateway.config.AnamGatewayProperties;
import com.kumc.anam.gateway.model.ApiResponse;
import com.kumc.anam.gateway.model.CareHistoryRequest;
import com.kumc.anam.gateway.model.DateRangeRequest;
import com.kumc.anam.gateway.model.LabTestRequest;
import com.kumc.anam.gateway.model.LoginRequest;
import com.kumc.anam.gateway.model.LoginResponse;
import com.kumc.anam.gateway.model.MedicationRequest;
import com.kumc.anam.gateway.model.PaymentDetailRequest;
import com.kumc.anam.gateway.model.PaymentListRequest;
import com.kumc.anam.gateway.model.ReservationRequest;
import com.kumc.anam.gateway.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.function.Function;

/**
 * Runs one portal operation per call.
 * <p>
 * Every call opens its own portal session for the caller's credentials, signs in, performs
 * exactly one query and closes the session on every exit path. Sessions are never reused
 * across requests. Any failure on the way becomes a failure envelope rather than an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortalGatewayService {

    static final String LOGIN_SUCCESS_MESSAGE = "로그인 성공";
    static final String LOGIN_FAILURE_PREFIX = "로그인 실패: ";

    static final int OUTPATIENT_INQUIRY = 2;
    static final int INPATIENT_INQUIRY = 3;

    private final PortalClientFactory clientFactory;
    private final TokenService tokenService;
    private final AnamGatewayProperties properties;

    /**
     * Sign in against the portal and, if it accepts the credentials, issue an access token.
     * Portal rejection is reported in the response, never thrown.
     */
    public LoginResponse login(LoginRequest request) {
        PortalCredentials credentials = new PortalCredentials(request.getIdentifier(), request.getSecret());
        try (PortalClient client = clientFactory.create(credentials)) {
            client.signIn();
            String accessToken = tokenService.issue(credentials);
            log.info("Login succeeded: identifier={}", credentials.getIdentifier());
            return LoginResponse.succeeded(LOGIN_SUCCESS_MESSAGE, accessToken);
        } catch (Exception e) {
            log.warn("Login failed: identifier={}, error={}", credentials.getIdentifier(), describe(e));
            return LoginResponse.failed(LOGIN_FAILURE_PREFIX + describe(e));
        }
    }

    public ApiResponse userInfo(PortalCredentials credentials) {
        return execute(credentials, "user-info", PortalClient::getInfo);
    }

    public ApiResponse reservations(PortalCredentials credentials, ReservationRequest request) {
        String hpCd = facilityCode(request);
        return execute(credentials, "reservations",
                client -> client.getReservations(hpCd, request.getStartDate(), request.getEndDate()));
    }

    public ApiResponse labTests(PortalCredentials credentials, LabTestRequest request) {
        String hpCd = facilityCode(request);
        return execute(credentials, "lab-tests",
                client -> client.getHealthCheckResult(hpCd, request.getStartDate(), request.getEndDate()));
    }

    public ApiResponse medications(PortalCredentials credentials, MedicationRequest request) {
        String hpCd = facilityCode(request);
        return execute(credentials, "medications",
                client -> client.getMedicationPrescriptionHistory(hpCd, request.getStartDate(), request.getEndDate()));
    }

    public ApiResponse outpatientHistory(PortalCredentials credentials, CareHistoryRequest request) {
        String hpCd = facilityCode(request);
        logInquiryMismatch(request, OUTPATIENT_INQUIRY);
        return execute(credentials, "outpatient-history",
                client -> client.getAmbulatoryCareHistory(
                        hpCd, request.getStartDate(), request.getEndDate(), OUTPATIENT_INQUIRY));
    }

    public ApiResponse hospitalizationHistory(PortalCredentials credentials, CareHistoryRequest request) {
        String hpCd = facilityCode(request);
        logInquiryMismatch(request, INPATIENT_INQUIRY);
        return execute(credentials, "hospitalization-history",
                client -> client.getHospitalizationAndDischargeHistory(
                        hpCd, request.getStartDate(), request.getEndDate(), INPATIENT_INQUIRY));
    }

    public ApiResponse payments(PortalCredentials credentials, PaymentListRequest request) {
        String hpCd = facilityCode(request);
        String codvCd = StringUtils.hasText(request.getCodeDivision())
                ? request.getCodeDivision()
                : PaymentListRequest.OUTPATIENT;
        return execute(credentials, "payments",
                client -> client.getPayedList(hpCd, request.getStartDate(), request.getEndDate(), codvCd));
    }

    public ApiResponse paymentDetail(PortalCredentials credentials, PaymentDetailRequest request) {
        String hpCd = facilityCode(request.getFacilityCode());
        return execute(credentials, "payment-detail",
                client -> client.getPayedDetail(hpCd, request.getPaymentNumber()));
    }

    private ApiResponse execute(
            PortalCredentials credentials, String operation, Function<PortalClient, JsonNode> query) {
        long start = System.currentTimeMillis();
        try (PortalClient client = clientFactory.create(credentials)) {
            client.signIn();
            JsonNode data = query.apply(client);
            log.info("Portal query completed: operation={}, identifier={}, durationMs={}",
                    operation, credentials.getIdentifier(), System.currentTimeMillis() - start);
            return ApiResponse.ok(data);
        } catch (Exception e) {
            log.warn("Portal query failed: operation={}, identifier={}, error={}",
                    operation, credentials.getIdentifier(), describe(e));
            return ApiResponse.failure(describe(e));
        }
    }

    private String facilityCode(DateRangeRequest request) {
        return facilityCode(request.getFacilityCode());
    }

    private String facilityCode(String requested) {
        return StringUtils.hasText(requested)
                ? requested
                : properties.getPortal().getDefaultHospitalCode();
    }

    private void logInquiryMismatch(CareHistoryRequest request, int expected) {
        if (request.getInquiryType() != null && request.getInquiryType() != expected) {
            log.debug("Ignoring inquiry_type={}; this endpoint always queries inquiry type {}",
                    request.getInquiryType(), expected);
        }
    }

    /**
     * Text for a failure envelope. Never empty.
     */
    static String describe(Exception e) {
        String message = e.getMessage();
        return StringUtils.hasText(message) ? message : e.getClass().getSimpleName();
    }
}
