package com.mylab.labservice.domain.handoff;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Versioned description of the material a handoff moves.
 *
 * @param schemaVersion  layout version of this structure
 * @param materialName   what is handed over
 * @param sourceSampleId optional sample in the initiator's workspace the material comes from
 * @param quantity       optional amount
 * @param unit           unit of {@code quantity}
 * @param description    optional free text
 */
public record MaterialDescriptor(
        int schemaVersion,
        String materialName,
        UUID sourceSampleId,
        BigDecimal quantity,
        String unit,
        String description) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public MaterialDescriptor {
        if (schemaVersion <= 0) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
    }
}
