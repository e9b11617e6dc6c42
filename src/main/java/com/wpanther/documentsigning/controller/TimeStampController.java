package com.wpanther.documentsigning.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.documentsigning.service.TimeStampAuthorityService;

import lombok.RequiredArgsConstructor;

/**
 * RFC 3161 over HTTP for the internal time-stamping authority.
 */
@RestController
@RequestMapping("/api/v1/tsa")
@RequiredArgsConstructor
public class TimeStampController {

    public static final String TIMESTAMP_QUERY = "application/timestamp-query";
    public static final String TIMESTAMP_REPLY = "application/timestamp-reply";

    private final TimeStampAuthorityService timeStampAuthorityService;

    @PostMapping(consumes = TIMESTAMP_QUERY, produces = TIMESTAMP_REPLY)
    public ResponseEntity<byte[]> timestamp(@RequestBody(required = false) byte[] query) {
        byte[] reply = timeStampAuthorityService.timestamp(query != null ? query : new byte[0]);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(TIMESTAMP_REPLY))
                .body(reply);
    }
}
