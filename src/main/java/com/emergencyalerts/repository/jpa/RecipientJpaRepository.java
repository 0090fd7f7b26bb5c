package com.emergencyalerts.repository.jpa;

import com.emergencyalerts.entity.RecipientEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RecipientJpaRepository extends JpaRepository<RecipientEntity, String> {

    Optional<RecipientEntity> findByEmail(String email);
}
