package com.vidnyan.aro.domain.check;

import com.vidnyan.aro.domain.diagnostic.Diagnostic;

import java.util.List;

/**
 * A program-wide static pass. Checks are independent: none sees or suppresses another's findings.
 */
public interface ProgramCheck {

    /**
     * Run the check and return its findings in a deterministic order.
     */
    List<Diagnostic> check(CheckContext context);

    /**
     * Get the check name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
