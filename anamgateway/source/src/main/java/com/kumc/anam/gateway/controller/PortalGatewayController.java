package com.kumc.anam.gateway.controller;

import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.gateway.model.ApiResponse;
import com.kumc.anam.gateway.model.CareHistoryRequest;
import com.kumc.anam.gateway.model.LabTestRequest;
import com.kumc.anam.gateway.model.LoginRequest;
import com.kumc.anam.gateway.model.LoginResponse;
import com.kumc.anam.gateway.model.MedicationRequest;
import com.kumc.anam.gateway.model.PaymentDetailRequest;
import com.kumc.anam.gateway.model.PaymentListRequest;
import com.kumc.anam.gateway.model.ReservationRequest;
import com.kumc.anam.gateway.security.BearerCredentials;
import com.kumc.anam.gateway.service.PortalGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Portal API.
 *
 * Every endpoint except login needs {@code Authorization: Bearer <token>} from a previous login.
 * Portal failures come back as HTTP 200 with {@code success: false}; only request validation
 * (422) and token problems (401) use HTTP error codes.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class PortalGatewayController {

    private final PortalGatewayService gatewayService;

    /**
     * POST /api/auth/login
     */
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login request: identifier={}", request.getIdentifier());
        return ResponseEntity.ok(gatewayService.login(request));
    }

    /**
     * GET /api/user/info
     */
    @GetMapping("/user/info")
    public ResponseEntity<ApiResponse> userInfo(@BearerCredentials PortalCredentials credentials) {
        return ResponseEntity.ok(gatewayService.userInfo(credentials));
    }

    @PostMapping("/reservations")
    public ResponseEntity<ApiResponse> reservations(
            @Valid @RequestBody ReservationRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Reservations request: {}", request);
        return ResponseEntity.ok(gatewayService.reservations(credentials, request));
    }

    @PostMapping("/lab-tests")
    public ResponseEntity<ApiResponse> labTests(
            @Valid @RequestBody LabTestRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Lab test request: {}", request);
        return ResponseEntity.ok(gatewayService.labTests(credentials, request));
    }

    @PostMapping("/medications")
    public ResponseEntity<ApiResponse> medications(
            @Valid @RequestBody MedicationRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Medication request: {}", request);
        return ResponseEntity.ok(gatewayService.medications(credentials, request));
    }

    @PostMapping("/outpatient-history")
    public ResponseEntity<ApiResponse> outpatientHistory(
            @Valid @RequestBody CareHistoryRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Outpatient history request: {}", request);
        return ResponseEntity.ok(gatewayService.outpatientHistory(credentials, request));
    }

    @PostMapping("/hospitalization-history")
    public ResponseEntity<ApiResponse> hospitalizationHistory(
            @Valid @RequestBody CareHistoryRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Hospitalization history request: {}", request);
        return ResponseEntity.ok(gatewayService.hospitalizationHistory(credentials, request));
    }

    @PostMapping("/payments")
    public ResponseEntity<ApiResponse> payments(
            @Valid @RequestBody PaymentListRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Payment list request: {}", request);
        return ResponseEntity.ok(gatewayService.payments(credentials, request));
    }

    @PostMapping("/payments/detail")
    public ResponseEntity<ApiResponse> paymentDetail(
            @Valid @RequestBody PaymentDetailRequest request,
            @BearerCredentials PortalCredentials credentials) {
        log.debug("Payment detail request: {}", request);
        return ResponseEntity.ok(gatewayService.paymentDetail(credentials, request));
    }
}
