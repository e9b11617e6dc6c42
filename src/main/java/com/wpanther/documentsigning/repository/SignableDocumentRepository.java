package com.wpanther.documentsigning.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.model.DocumentStatus;

@Repository
public interface SignableDocumentRepository extends JpaRepository<SignableDocumentEntity, String> {

    /**
     * Find documents in a given lifecycle state
     */
    List<SignableDocumentEntity> findByStatus(DocumentStatus status);
}
