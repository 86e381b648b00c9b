package com.kumc.anam.gateway.security;

/**
 * Missing, malformed, tampered, expired or unknown token.
 */
public class InvalidTokenException extends TokenException {

    public static final String DETAIL = "유효하지 않은 인증 토큰입니다.";

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getDetail() {
        return DETAIL;
    }
}
