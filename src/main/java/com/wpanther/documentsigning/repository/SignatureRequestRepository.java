package com.wpanther.documentsigning.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.documentsigning.entity.SignatureRequest;

@Repository
public interface SignatureRequestRepository extends JpaRepository<SignatureRequest, String> {

    /**
     * Find the request addressed by a signer link
     */
    Optional<SignatureRequest> findByLinkToken(String linkToken);

    /**
     * Active requests of a document in signing order
     */
    List<SignatureRequest> findByDocumentIdAndCancelledAtIsNullOrderBySigningOrderAsc(String documentId);

    /**
     * Lowest-order active request that still waits for its signature
     */
    Optional<SignatureRequest> findFirstByDocumentIdAndCancelledAtIsNullAndSignedFalseOrderBySigningOrderAsc(
            String documentId);

    long countByDocumentIdAndCancelledAtIsNull(String documentId);

    boolean existsByDocumentIdAndCancelledAtIsNull(String documentId);

    List<SignatureRequest> findByDocumentId(String documentId);
}
