package com.encdiary.server.dto;

import jakarta.json.bind.annotation.JsonbProperty;

/**
 * Body of create and update calls. Both fields are ciphertext.
 */
public class EntryRequest {
    @JsonbProperty("encrypted_title")
    public String encryptedTitle;

    @JsonbProperty("encrypted_content")
    public String encryptedContent;

    public EntryRequest() {}

    public EntryRequest(String encryptedTitle, String encryptedContent) {
        this.encryptedTitle = encryptedTitle;
        this.encryptedContent = encryptedContent;
    }
}
