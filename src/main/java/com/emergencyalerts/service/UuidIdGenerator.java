package com.emergencyalerts.service;

import com.emergencyalerts.domain.IdGenerator;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class UuidIdGenerator implements IdGenerator {

    @Override
    public String newId() {
        return UUID.randomUUID().toString();
    }
}
