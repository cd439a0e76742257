package com.mixtape.playlist.infrastructure.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update of a playlist's metadata.
 * <p>
 * Tracks which fields were present in the body so an explicit {@code "description": null}
 * clears the description while an omitted description leaves it unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdatePlaylistRequest {

    @Size(min = 1, max = 100, message = "Name must be between 1 and 100 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
    private String name;

    @Size(max = 255, message = "Description must be at most 255 characters")
    private String description;

    @JsonIgnore
    private boolean namePresent;

    @JsonIgnore
    private boolean descriptionPresent;

    public UpdatePlaylistRequest() {
    }

    public UpdatePlaylistRequest(String name, String description) {
        if (name != null) {
            setName(name);
        }
        if (description != null) {
            setDescription(description);
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        this.namePresent = true;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
        this.descriptionPresent = true;
    }

    @JsonIgnore
    public boolean isDescriptionPresent() {
        return descriptionPresent;
    }

    @JsonIgnore
    @AssertTrue(message = "At least one field must be provided")
    public boolean isAnyFieldPresent() {
        return namePresent || descriptionPresent;
    }

    @JsonIgnore
    @AssertTrue(message = "Name cannot be cleared")
    public boolean isNameNotNullWhenPresent() {
        return !namePresent || name != null;
    }
}
