package com.wpanther.documentsigning.service;

import java.io.IOException;
import java.math.BigInteger;
import java.security.cert.CertificateEncodingException;
import java.time.Clock;
import java.util.Date;
import java.util.HexFormat;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.cmp.PKIFailureInfo;
import org.bouncycastle.asn1.cmp.PKIStatus;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.SignerInfoGenerator;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.DefaultDigestAlgorithmIdentifierFinder;
import org.bouncycastle.operator.DigestCalculator;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.bouncycastle.tsp.TSPAlgorithms;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TSPValidationException;
import org.bouncycastle.tsp.TimeStampRequest;
import org.bouncycastle.tsp.TimeStampResponse;
import org.bouncycastle.tsp.TimeStampResponseGenerator;
import org.bouncycastle.tsp.TimeStampTokenGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import com.wpanther.documentsigning.exception.TsaException;
import com.wpanther.documentsigning.exception.TsaTimeoutException;
import com.wpanther.documentsigning.model.SigningIdentity;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.util.CertificateUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Internal RFC 3161 time-stamping authority.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeStampAuthorityService {

    static final Set<ASN1ObjectIdentifier> ACCEPTED_ALGORITHMS = Set.of(
            TSPAlgorithms.SHA256, TSPAlgorithms.SHA384, TSPAlgorithms.SHA512);

    private final TrustMaterial trustMaterial;
    private final TsaSerialAllocator tsaSerialAllocator;
    private final ThreadPoolTaskExecutor tsaExecutor;
    private final Clock clock;

    @Value("${app.tsa.timeout-seconds:5}")
    private long timeoutSeconds;

    @Value("${app.tsa.policy-oid:1.2.3.4.1}")
    private String policyOid;

    /**
     * Answers a DER encoded TimeStampReq with a DER encoded TimeStampResp.
     * Requests that cannot be parsed or use an unsupported hash get a
     * rejection response, not an exception.
     */
    public byte[] timestamp(byte[] requestBytes) {
        if (requestBytes == null || requestBytes.length == 0) {
            return rejection(PKIFailureInfo.badDataFormat, "Empty time-stamp request");
        }
        TimeStampRequest request;
        try {
            request = parse(requestBytes);
        } catch (IOException | RuntimeException e) {
            log.warn("Rejecting malformed time-stamp request: {}", e.getMessage());
            return rejection(PKIFailureInfo.badDataFormat, "Malformed time-stamp request");
        }
        try {
            return respond(request).getEncoded();
        } catch (IOException e) {
            throw new TsaException("Failed to encode time-stamp response: " + e.getMessage(), e);
        }
    }

    /**
     * BouncyCastle reports corrupt DER through unchecked exceptions as well as
     * IOException, and some of them only when a field is first read.
     */
    private static TimeStampRequest parse(byte[] requestBytes) throws IOException {
        TimeStampRequest request = new TimeStampRequest(requestBytes);
        request.getMessageImprintAlgOID();
        request.getMessageImprintDigest();
        request.getReqPolicy();
        request.getNonce();
        request.getCertReq();
        request.hasExtensions();
        return request;
    }

    /**
     * Issues a response within the configured time budget.
     *
     * @throws TsaTimeoutException if issuance does not finish in time
     * @throws TsaException on any other issuance failure
     */
    public TimeStampResponse respond(TimeStampRequest request) {
        long timeoutMillis = TimeUnit.SECONDS.toMillis(timeoutSeconds);
        Future<TimeStampResponse> future;
        try {
            future = tsaExecutor.submit(() -> issue(request));
        } catch (TaskRejectedException e) {
            throw new TsaException("Timestamp authority is saturated", e);
        }

        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Timestamp issuance timed out after {} ms", timeoutMillis);
            throw new TsaTimeoutException(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TsaException("Interrupted while waiting for timestamp", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TsaException) {
                throw (TsaException) cause;
            }
            throw new TsaException("Timestamp issuance failed: " + cause.getMessage(), cause);
        }
    }

    TimeStampResponse issue(TimeStampRequest request) {
        try {
            TimeStampTokenGenerator tokenGenerator = newTokenGenerator();
            TimeStampResponseGenerator responseGenerator =
                    new TimeStampResponseGenerator(tokenGenerator, ACCEPTED_ALGORITHMS);

            try {
                request.validate(ACCEPTED_ALGORITHMS, null, null);
            } catch (TSPValidationException e) {
                log.warn("Rejecting time-stamp request: {}", e.getMessage());
                int failInfo = e.getFailureCode() >= 0 ? e.getFailureCode() : PKIFailureInfo.badRequest;
                return responseGenerator.generateFailResponse(PKIStatus.REJECTION, failInfo, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Rejecting unreadable time-stamp request: {}", e.getMessage());
                return responseGenerator.generateFailResponse(PKIStatus.REJECTION, PKIFailureInfo.badDataFormat,
                        "Malformed time-stamp request");
            }

            BigInteger serial = tsaSerialAllocator.allocate(request.getMessageImprintAlgOID().getId(),
                    HexFormat.of().formatHex(request.getMessageImprintDigest()));
            Date genTime = Date.from(clock.instant());
            TimeStampResponse response = responseGenerator.generateGrantedResponse(request, serial, genTime);
            log.info("Issued timestamp serial={} genTime={}", serial, genTime.toInstant());
            return response;
        } catch (TSPException | OperatorCreationException | CertificateEncodingException e) {
            throw new TsaException("Failed to generate timestamp: " + e.getMessage(), e);
        }
    }

    /**
     * Generators hold a signature engine and are not shared between threads.
     */
    private TimeStampTokenGenerator newTokenGenerator()
            throws OperatorCreationException, CertificateEncodingException, TSPException {
        SigningIdentity tsa = trustMaterial.getTimeStampAuthority();
        SignerInfoGenerator signerInfoGenerator = new JcaSimpleSignerInfoGeneratorBuilder()
                .build(CertificateUtil.SIGNATURE_ALGORITHM, tsa.getPrivateKey(), tsa.getCertificate());
        DigestCalculator certIdDigest = new JcaDigestCalculatorProviderBuilder().build()
                .get(new DefaultDigestAlgorithmIdentifierFinder().find("SHA-256"));

        TimeStampTokenGenerator generator = new TimeStampTokenGenerator(signerInfoGenerator, certIdDigest,
                new ASN1ObjectIdentifier(policyOid));
        generator.setAccuracySeconds(1);
        generator.addCertificates(new JcaCertStore(tsa.getChain()));
        return generator;
    }

    private byte[] rejection(int failInfo, String message) {
        try {
            TimeStampResponseGenerator generator = new TimeStampResponseGenerator(newTokenGenerator(),
                    ACCEPTED_ALGORITHMS);
            return generator.generateFailResponse(PKIStatus.REJECTION, failInfo, message).getEncoded();
        } catch (TSPException | OperatorCreationException | CertificateEncodingException | IOException e) {
            throw new TsaException("Failed to build rejection response: " + e.getMessage(), e);
        }
    }
}
