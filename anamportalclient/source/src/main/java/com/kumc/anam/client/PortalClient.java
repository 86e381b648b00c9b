package com.kumc.anam.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Session against the Anam hospital patient portal.
 * <p>
 * One instance holds one signed-in portal session for one set of credentials.
 * Instances are not shared between requests: callers open one, call {@link #signIn()},
 * run their query and close it.
 * <p>
 * Parameter names follow the portal's own field names (hpCd, strtYmd, ...). Dates are
 * 8-digit {@code yyyyMMdd} numbers. Results are returned as the portal sent them.
 */
public interface PortalClient extends AutoCloseable {

    /**
     * Sign in with the credentials this client was created for.
     *
     * @throws PortalSignInException if the portal rejects the credentials
     * @throws PortalClientException on transport or response errors
     */
    void signIn();

    /**
     * Profile of the signed-in member.
     */
    JsonNode getInfo();

    JsonNode getReservations(String hpCd, int apstYmd, int apfnYmd);

    /**
     * Diagnostic test (health check) results.
     */
    JsonNode getHealthCheckResult(String hpCd, int strtYmd, int fnshYmd);

    JsonNode getMedicationPrescriptionHistory(String hpCd, int ordrYmd1, int ordrYmd2);

    JsonNode getAmbulatoryCareHistory(String hpCd, int inqrStrtYmd, int inqrFnshYmd, int inqrDvsnCd);

    JsonNode getHospitalizationAndDischargeHistory(String hpCd, int inqrStrtYmd, int inqrFnshYmd, int inqrDvsnCd);

    /**
     * Completed payments.
     *
     * @param codvCd division code, O for outpatient and I for inpatient
     */
    JsonNode getPayedList(String hpCd, int strtYmd, int fnshYmd, String codvCd);

    JsonNode getPayedDetail(String hpCd, long mdrpNo);

    /**
     * Drop the portal session. Safe to call more than once.
     */
    @Override
    void close();
}
