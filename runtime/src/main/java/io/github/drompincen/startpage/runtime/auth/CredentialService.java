package io.github.drompincen.startpage.runtime.auth;

import io.github.drompincen.startpage.persistence.document.AdminDocument;
import io.github.drompincen.startpage.persistence.repository.AdminRepository;
import io.github.drompincen.startpage.runtime.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Holds the one admin identity. The username is fixed to {@link AdminDocument#ADMIN_USERNAME};
 * only the password hash ever changes.
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final AdminRepository adminRepository;
    private final PasswordHasher passwordHasher;
    private final Clock clock;
    private final String defaultPassword;

    public CredentialService(AdminRepository adminRepository,
                             PasswordHasher passwordHasher,
                             Clock clock,
                             @Value("${startpage.auth.default-password:admin123}") String defaultPassword) {
        this.adminRepository = adminRepository;
        this.passwordHasher = passwordHasher;
        this.clock = clock;
        this.defaultPassword = defaultPassword;
    }

    /** Creates the admin record on first run; warns while the default password is still in place. */
    public void ensureAdmin() {
        var existing = adminRepository.findById(AdminDocument.ADMIN_USERNAME);
        if (existing.isEmpty()) {
            AdminDocument admin = new AdminDocument();
            admin.setPasswordHash(passwordHasher.hash(defaultPassword));
            admin.setCreatedAt(clock.instant());
            adminRepository.save(admin);
            log.warn("Created admin account '{}' with the default password; change it before exposing this service",
                    AdminDocument.ADMIN_USERNAME);
            return;
        }
        if (passwordHasher.verify(existing.get().getPasswordHash(), defaultPassword)) {
            log.warn("Admin account '{}' still uses the default password", AdminDocument.ADMIN_USERNAME);
        }
    }

    public boolean verify(String password) {
        return adminRepository.findById(AdminDocument.ADMIN_USERNAME)
                .map(admin -> passwordHasher.verify(admin.getPasswordHash(), password))
                .orElse(false);
    }

    public synchronized void changePassword(String oldPassword, String newPassword) {
        if (newPassword == null || newPassword.isBlank()) {
            throw new InvalidArgumentException("New password must not be empty");
        }
        AdminDocument admin = adminRepository.findById(AdminDocument.ADMIN_USERNAME)
                .orElseThrow(() -> new IllegalStateException("Admin account is missing"));
        if (!passwordHasher.verify(admin.getPasswordHash(), oldPassword)) {
            throw new IncorrectPasswordException();
        }
        admin.setPasswordHash(passwordHasher.hash(newPassword));
        admin.setPasswordChangedAt(clock.instant());
        adminRepository.save(admin);
        log.info("Admin password changed");
    }
}
