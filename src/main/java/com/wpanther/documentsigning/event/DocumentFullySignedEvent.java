package com.wpanther.documentsigning.event;

import java.time.Instant;
import java.util.List;

import com.wpanther.documentsigning.model.Signer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Published once, when the document reaches SIGNED.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class DocumentFullySignedEvent {
    private final String documentId;
    private final String documentName;
    private final String fileName;
    private final List<Signer> signers;
    private final Instant signedAt;
}
