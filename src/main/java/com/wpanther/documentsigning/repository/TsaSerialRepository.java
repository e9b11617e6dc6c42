package com.wpanther.documentsigning.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.documentsigning.entity.TsaSerial;

@Repository
public interface TsaSerialRepository extends JpaRepository<TsaSerial, Long> {
}
