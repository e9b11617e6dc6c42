package com.wpanther.documentsigning.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per allocated timestamp serial. The identity column is the serial:
 * the database hands out each value once, even to concurrent instances.
 */
@Entity
@Table(name = "tsa_serials")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TsaSerial {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "allocated_at", nullable = false, updatable = false)
    private Instant allocatedAt;

    @Column(name = "hash_algorithm", updatable = false, length = 64)
    private String hashAlgorithm;

    @Column(name = "message_imprint", updatable = false, length = 128)
    private String messageImprint;
}
