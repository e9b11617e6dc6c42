package com.wpanther.documentsigning.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.wpanther.documentsigning.entity.SignatureRequest;
import com.wpanther.documentsigning.model.OtpCheckResult;

import lombok.RequiredArgsConstructor;

/**
 * Generates and checks the 6-digit one-time codes sent to signers.
 * Checking never mutates the request.
 */
@Service
@RequiredArgsConstructor
public class OtpService {

    private final SecureRandom secureRandom;
    private final Clock clock;

    @Value("${app.otp.max-age-minutes:10}")
    private long maxAgeMinutes = 10;

    public String generateCode() {
        return String.valueOf(100000 + secureRandom.nextInt(900000));
    }

    /**
     * Replaces any previous code on the request with a fresh one.
     */
    public String assignNewCode(SignatureRequest request) {
        String code = generateCode();
        request.setOtpCode(code);
        request.setOtpGeneratedAt(clock.instant());
        return code;
    }

    public OtpCheckResult check(SignatureRequest request, String submitted) {
        if (request.getOtpCode() == null || request.getOtpGeneratedAt() == null) {
            return OtpCheckResult.NOT_ISSUED;
        }
        if (submitted == null || !MessageDigest.isEqual(
                request.getOtpCode().getBytes(StandardCharsets.US_ASCII),
                submitted.trim().getBytes(StandardCharsets.US_ASCII))) {
            return OtpCheckResult.WRONG;
        }
        Instant deadline = request.getOtpGeneratedAt().plus(Duration.ofMinutes(maxAgeMinutes));
        if (clock.instant().isAfter(deadline)) {
            return OtpCheckResult.EXPIRED;
        }
        return OtpCheckResult.VALID;
    }

    public Duration getMaxAge() {
        return Duration.ofMinutes(maxAgeMinutes);
    }
}
