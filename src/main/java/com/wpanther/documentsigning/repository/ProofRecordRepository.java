package com.wpanther.documentsigning.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.documentsigning.entity.ProofRecord;

@Repository
public interface ProofRecordRepository extends JpaRepository<ProofRecord, String> {

    /**
     * Proof records of a document in chronological order
     */
    List<ProofRecord> findByDocumentIdOrderBySignatureTimestampAsc(String documentId);

    /**
     * Number of completed signatures, the source of truth for finalization
     */
    long countByDocumentId(String documentId);

    boolean existsBySignatureRequestId(String signatureRequestId);
}
