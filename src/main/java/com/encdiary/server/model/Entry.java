package com.encdiary.server.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A diary entry. Title and content are ciphertext produced by the browser;
 * the server stores and returns them unchanged.
 */
@Entity
@Table(name = "entry")
public class Entry {
    public static final int MAX_TITLE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "encrypted_title", nullable = false, length = MAX_TITLE_LENGTH)
    private String encryptedTitle;

    @Column(name = "encrypted_content", nullable = false, columnDefinition = "text")
    private String encryptedContent;

    @Column(name = "date_created", nullable = false, updatable = false)
    private Instant dateCreated;

    @Column(name = "date_modified", nullable = false)
    private Instant dateModified;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getEncryptedTitle() { return encryptedTitle; }
    public void setEncryptedTitle(String t) { this.encryptedTitle = t; }
    public String getEncryptedContent() { return encryptedContent; }
    public void setEncryptedContent(String c) { this.encryptedContent = c; }
    public Instant getDateCreated() { return dateCreated; }
    public void setDateCreated(Instant t) { this.dateCreated = t; }
    public Instant getDateModified() { return dateModified; }
    public void setDateModified(Instant t) { this.dateModified = t; }
    public Long getUserId() { return userId; }
    public void setUserId(Long id) { this.userId = id; }

    public boolean isOwnedBy(long ownerId) {
        return userId != null && userId == ownerId;
    }
}
