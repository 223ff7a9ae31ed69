package com.ai.clinic.config;

import com.ai.clinic.service.ClinicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Sample doctors, slots and patients for local runs. Off unless clinic.seed.enabled=true.
 */
@Configuration
@ConditionalOnProperty(prefix = "clinic.seed", name = "enabled", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedClinic(ClinicService clinicService) {
        return args -> {
            if (!clinicService.listDoctors().isEmpty()) {
                log.info("Doctors already present, skipping seed");
                return;
            }

            clinicService.addDoctor(1L, "Dr. Rao", "General");
            clinicService.addDoctor(2L, "Dr. Mehta", "Cardio");

            clinicService.addSlot(1L, 101L, "09:00", "09:15");
            clinicService.addSlot(1L, 102L, "09:15", "09:30");
            clinicService.addSlot(2L, 201L, "10:00", "10:15");
            clinicService.addSlot(2L, 202L, "10:15", "10:30");

            clinicService.registerPatient(1L, "Alice", 30, 0);
            clinicService.registerPatient(2L, "Bob", 45, 0);
            clinicService.registerPatient(3L, "Charlie", 25, 0);

            log.info("Seeded 2 doctors, 4 slots and 3 patients");
        };
    }
}
