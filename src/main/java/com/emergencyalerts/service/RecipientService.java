package com.emergencyalerts.service;

import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.model.Recipient;
import com.emergencyalerts.exception.ResourceNotFoundException;
import com.emergencyalerts.mapper.RecipientMapper;
import com.emergencyalerts.repository.jpa.RecipientJpaRepository;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Recipients are created lazily the first time the delivery subsystem reports an attempt for
 * an address. Two first reports racing on the same address resolve to one row through the
 * unique email constraint.
 */
@Service
public class RecipientService {

    private static final Logger log = LoggerFactory.getLogger(RecipientService.class);

    private final RecipientJpaRepository recipientJpaRepository;
    private final RecipientMapper recipientMapper;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public RecipientService(
            RecipientJpaRepository recipientJpaRepository,
            RecipientMapper recipientMapper,
            IdGenerator idGenerator,
            Clock clock) {
        this.recipientJpaRepository = recipientJpaRepository;
        this.recipientMapper = recipientMapper;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public Recipient get(String recipientId) {
        return recipientJpaRepository
                .findById(recipientId)
                .map(recipientMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Recipient", recipientId));
    }

    public Recipient findOrCreate(String email, String displayName) {
        String normalized = Recipient.normalizeEmail(email);
        return recipientJpaRepository
                .findByEmail(normalized)
                .map(recipientMapper::toDomain)
                .orElseGet(() -> create(normalized, displayName));
    }

    private Recipient create(String email, String displayName) {
        Recipient recipient = Recipient.builder()
                .id(idGenerator.newId())
                .email(email)
                .displayName(displayName == null || displayName.isBlank() ? null : displayName.trim())
                .active(true)
                .createdAt(clock.instant())
                .build();
        try {
            recipientJpaRepository.saveAndFlush(recipientMapper.toEntity(recipient));
            log.info("Created recipient {} for {}", recipient.getId(), email);
            return recipient;
        } catch (DataIntegrityViolationException e) {
            log.debug("Recipient {} created concurrently, reusing existing row", email);
            return recipientJpaRepository
                    .findByEmail(email)
                    .map(recipientMapper::toDomain)
                    .orElseThrow(() -> e);
        }
    }
}
