package com.tableops.backend.modules.auth.infrastructure.persistence;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Recognises {@code staff_account} constraint violations raised by a flush.
 */
public final class StaffAccountConstraints {

    static final String UNIQUE_EMAIL = "uq_staff_account_email";

    private StaffAccountConstraints() {
    }

    public static boolean isDuplicateEmail(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(UNIQUE_EMAIL);
    }
}
