package com.deviceotp.domain;

/**
 * Submitted code exactly as the client sent it. Clients send either a JSON string or an integer;
 * leading zeros lost by the integer form are restored during validation.
 */
public record OtpValue(String text) {
}
