package com.kumc.anam.client.http;

import lombok.Data;

import java.time.Duration;

/**
 * Connection settings for {@link RestPortalClient}.
 * Bound from configuration by the application that embeds the client.
 */
@Data
public class PortalClientSettings {

    private String baseUrl = "https://anam.kumc.or.kr";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    private Paths paths = new Paths();

    /**
     * Portal endpoint paths, relative to {@link #baseUrl}.
     */
    @Data
    public static class Paths {
        private String signIn = "/api/member/login";
        private String memberInfo = "/api/mypage/member/info";
        private String reservations = "/api/mypage/reservations";
        private String healthCheckResults = "/api/mypage/health-check/results";
        private String medicationPrescriptions = "/api/mypage/prescriptions";
        private String ambulatoryCareHistory = "/api/mypage/care-history/outpatient";
        private String hospitalizationHistory = "/api/mypage/care-history/inpatient";
        private String payedList = "/api/mypage/payments";
        private String payedDetail = "/api/mypage/payments/detail";
    }
}
