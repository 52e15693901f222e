package com.pipewright.core.admission;

/**
 * Result of running one {@link AdmissionCheck}.
 *
 * @param passed  whether the check passed
 * @param details summary shown for every run of the check
 * @param problem what is wrong, when the check did not pass
 * @param remedy  for blocking checks the fix; for warnings the expected impact
 */
public record CheckOutcome(boolean passed, String details, String problem, String remedy) {

    public static CheckOutcome pass(String details) {
        return new CheckOutcome(true, details, null, null);
    }

    public static CheckOutcome fail(String problem, String remedy) {
        return new CheckOutcome(false, problem, problem, remedy);
    }
}
