package com.kumc.anam.gateway.security;

/**
 * Token verified but lacks the member id or the credential claim.
 */
public class MissingClaimException extends TokenException {

    public static final String DETAIL = "인증 정보를 확인할 수 없습니다.";

    public MissingClaimException(String claim) {
        super("Token is missing claim: " + claim);
    }

    @Override
    public String getDetail() {
        return DETAIL;
    }
}
