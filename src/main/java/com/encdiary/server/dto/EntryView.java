package com.encdiary.server.dto;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.encdiary.server.model.Entry;

import jakarta.json.bind.annotation.JsonbProperty;
import jakarta.json.bind.annotation.JsonbPropertyOrder;

/**
 * An entry as returned by the list endpoint.
 */
@JsonbPropertyOrder({"id", "encryptedTitle", "encryptedContent", "dateCreated", "dateModified"})
public final class EntryView {

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final long id;
    private final String encryptedTitle;
    private final String encryptedContent;
    private final String dateCreated;
    private final String dateModified;

    public EntryView(long id, String encryptedTitle, String encryptedContent, String dateCreated, String dateModified) {
        this.id = id;
        this.encryptedTitle = encryptedTitle;
        this.encryptedContent = encryptedContent;
        this.dateCreated = dateCreated;
        this.dateModified = dateModified;
    }

    public static EntryView from(Entry entry) {
        return new EntryView(
                entry.getId(),
                entry.getEncryptedTitle(),
                entry.getEncryptedContent(),
                format(entry.getDateCreated()),
                format(entry.getDateModified()));
    }

    public static String format(Instant instant) {
        return instant == null ? null : TIMESTAMP.format(instant);
    }

    public long getId() {
        return id;
    }

    @JsonbProperty("encrypted_title")
    public String getEncryptedTitle() {
        return encryptedTitle;
    }

    @JsonbProperty("encrypted_content")
    public String getEncryptedContent() {
        return encryptedContent;
    }

    @JsonbProperty("date_created")
    public String getDateCreated() {
        return dateCreated;
    }

    @JsonbProperty("date_modified")
    public String getDateModified() {
        return dateModified;
    }
}
