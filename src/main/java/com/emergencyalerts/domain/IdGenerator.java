package com.emergencyalerts.domain;

/**
 * Source of new unique identifiers. Injected wherever an entity is minted so tests can
 * supply deterministic ids.
 */
@FunctionalInterface
public interface IdGenerator {

    String newId();
}
