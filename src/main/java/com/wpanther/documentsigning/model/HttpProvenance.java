package com.wpanther.documentsigning.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a signature confirmation came from, as seen by the HTTP layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HttpProvenance {

    public static final String UNKNOWN_ADDRESS = "0.0.0.0";

    private String ipAddress;
    private String userAgent;
    private String referer;
}
