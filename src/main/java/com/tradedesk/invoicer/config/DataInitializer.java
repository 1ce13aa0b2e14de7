package com.tradedesk.invoicer.config;

import com.tradedesk.invoicer.model.AppUser;
import com.tradedesk.invoicer.model.UserRole;
import com.tradedesk.invoicer.repository.AppUserRepository;
import com.tradedesk.invoicer.service.InvoiceSequencer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner init(AppUserRepository userRepo,
            InvoiceSequencer invoiceSequencer,
            PasswordEncoder encoder,
            @Value("${invoicing.admin.username:admin}") String adminUsername,
            @Value("${invoicing.admin.password:admin123}") String adminPassword) {
        return args -> {
            // Create Admin User
            if (userRepo.count() == 0) {
                AppUser admin = new AppUser();
                admin.setUsername(adminUsername);
                admin.setPasswordHash(encoder.encode(adminPassword));
                admin.setRole(UserRole.ADMIN);
                admin.setFullName("Administrator");
                userRepo.save(admin);
                logger.info("Default admin user '{}' created", adminUsername);
            }

            invoiceSequencer.ensureSequence();
        };
    }
}
