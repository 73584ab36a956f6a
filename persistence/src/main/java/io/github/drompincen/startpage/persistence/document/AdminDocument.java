package io.github.drompincen.startpage.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * The single administrator record. The id is always {@link #ADMIN_USERNAME}; there is no
 * user management, so the collection holds at most this one document.
 */
@Document(collection = "admin")
public class AdminDocument {

    public static final String ADMIN_USERNAME = "admin";

    @Id
    private String username = ADMIN_USERNAME;
    private String passwordHash;
    private Instant createdAt;
    private Instant passwordChangedAt;

    public AdminDocument() {}

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getPasswordChangedAt() { return passwordChangedAt; }
    public void setPasswordChangedAt(Instant passwordChangedAt) { this.passwordChangedAt = passwordChangedAt; }
}
