package com.mylab.labservice.domain.handoff;

import java.time.LocalDate;

/**
 * Fields the initiator may change while a request is open; null fields are left unchanged.
 */
public record SupplyChainRequestUpdate(Priority priority, LocalDate dueDate, String notes) {

    public boolean isEmpty() {
        return priority == null && dueDate == null && notes == null;
    }
}
