package com.wpanther.documentsigning.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.documentsigning.entity.TsaSerial;
import com.wpanther.documentsigning.repository.TsaSerialRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands out timestamp serial numbers from the database identity column.
 * Each allocation commits on its own, so a serial is burned rather than
 * reused when issuance fails afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TsaSerialAllocator {

    private final TsaSerialRepository tsaSerialRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BigInteger allocate(String hashAlgorithm, String messageImprint) {
        TsaSerial serial = tsaSerialRepository.saveAndFlush(TsaSerial.builder()
                .allocatedAt(Instant.now(clock))
                .hashAlgorithm(hashAlgorithm)
                .messageImprint(messageImprint)
                .build());
        log.debug("Allocated TSA serial={}", serial.getId());
        return BigInteger.valueOf(serial.getId());
    }
}
