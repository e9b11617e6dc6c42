package com.wpanther.documentsigning.service;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TimeStampRequest;
import org.bouncycastle.tsp.TimeStampRequestGenerator;
import org.bouncycastle.tsp.TimeStampResponse;
import org.bouncycastle.tsp.TimeStampToken;

import com.wpanther.documentsigning.exception.TsaException;

import eu.europa.esig.dss.enumerations.DigestAlgorithm;
import eu.europa.esig.dss.model.TimestampBinary;
import eu.europa.esig.dss.spi.x509.tsp.TSPSource;
import lombok.extern.slf4j.Slf4j;

/**
 * DSS {@link TSPSource} served in-process by the internal time-stamping authority.
 */
@Slf4j
public class InternalTspSource implements TSPSource {

    private static final long serialVersionUID = 1L;

    private final transient TimeStampAuthorityService timeStampAuthorityService;
    private final transient SecureRandom random = new SecureRandom();

    public InternalTspSource(TimeStampAuthorityService timeStampAuthorityService) {
        this.timeStampAuthorityService = timeStampAuthorityService;
    }

    @Override
    public TimestampBinary getTimeStampResponse(DigestAlgorithm digestAlgorithm, byte[] digest) {
        TimeStampRequestGenerator requestGenerator = new TimeStampRequestGenerator();
        requestGenerator.setCertReq(true);
        TimeStampRequest request = requestGenerator.generate(new ASN1ObjectIdentifier(digestAlgorithm.getOid()),
                digest, new BigInteger(64, random));

        TimeStampResponse response = timeStampAuthorityService.respond(request);
        try {
            response.validate(request);
        } catch (TSPException e) {
            throw new TsaException("Internal TSA returned an invalid response: " + e.getMessage(), e);
        }
        TimeStampToken token = response.getTimeStampToken();
        if (token == null) {
            throw new TsaException("Internal TSA refused the request: " + response.getStatusString());
        }
        try {
            log.debug("Internal TSA token serial={}", token.getTimeStampInfo().getSerialNumber());
            return new TimestampBinary(token.getEncoded());
        } catch (IOException e) {
            throw new TsaException("Failed to encode timestamp token: " + e.getMessage(), e);
        }
    }
}
