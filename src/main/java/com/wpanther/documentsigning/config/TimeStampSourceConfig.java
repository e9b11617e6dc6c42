package com.wpanther.documentsigning.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.wpanther.documentsigning.service.InternalTspSource;
import com.wpanther.documentsigning.service.TimeStampAuthorityService;

import eu.europa.esig.dss.service.tsp.OnlineTSPSource;
import eu.europa.esig.dss.spi.x509.tsp.TSPSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Timestamp sources used by the PDF signing engine. Approval signatures always
 * use the internal authority; certification may use an external one.
 */
@Configuration
@Slf4j
public class TimeStampSourceConfig {

    @Value("${app.tsa.url:}")
    private String externalTsaUrl;

    @Bean(name = "internalTspSource")
    public TSPSource internalTspSource(TimeStampAuthorityService timeStampAuthorityService) {
        return new InternalTspSource(timeStampAuthorityService);
    }

    @Bean(name = "certificationTspSource")
    public TSPSource certificationTspSource(@Qualifier("internalTspSource") TSPSource internalTspSource) {
        if (externalTsaUrl == null || externalTsaUrl.isBlank()) {
            return internalTspSource;
        }
        log.info("Certification timestamps requested from external TSA {}", externalTsaUrl);
        return new OnlineTSPSource(externalTsaUrl);
    }
}
