package com.apiplatform.controller.eventhub;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted version row of an organization.
 * The version id is regenerated on every successful publish.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationState {
    private String organization;
    private String versionId;
    private Instant updatedAt;
}
