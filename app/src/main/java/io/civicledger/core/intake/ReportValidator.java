package io.civicledger.core.intake;

import io.civicledger.core.protocol.Identity;
import io.civicledger.core.protocol.Location;
import io.civicledger.core.protocol.Urgency;

import java.util.ArrayList;
import java.util.List;

/**
 * Input rules for a report submission. All failed rules are reported together.
 */
public class ReportValidator {
    public static final int MIN_DESCRIPTION_LENGTH = 10;

    public void validate(ReportSubmission report) {
        if (report == null) {
            throw new IllegalArgumentException("Report required");
        }
        List<String> errors = new ArrayList<>();
        if (isBlank(report.category())) {
            errors.add("Category is required");
        }
        if (!isReportableUrgency(report.urgency())) {
            errors.add("Invalid urgency level");
        }
        if (report.description() == null || report.description().trim().length() < MIN_DESCRIPTION_LENGTH) {
            errors.add("Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters");
        }
        Identity identity = parseIdentity(report.identity());
        if (identity == null) {
            errors.add("Identity must be name or anonymous");
        } else if (identity == Identity.NAMED && isBlank(report.citizenId())) {
            errors.add("Citizen id is required for named reports");
        }
        Location location = report.location();
        if (location == null) {
            errors.add("Location is required");
        } else {
            if (isBlank(location.area())) errors.add("Location area is required");
            if (isBlank(location.address())) errors.add("Location address is required");
            if (isBlank(location.nearestStation())) errors.add("Nearest station is required");
        }
        for (String e : report.evidence()) {
            if (isBlank(e)) {
                errors.add("Evidence references must not be blank");
                break;
            }
        }
        for (String a : report.authorities()) {
            if (isBlank(a)) {
                errors.add("Authority names must not be blank");
                break;
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
    }

    static Identity parseIdentity(String label) {
        for (Identity i : Identity.values()) {
            if (i.label().equals(label)) return i;
        }
        return null;
    }

    private static boolean isReportableUrgency(String label) {
        for (Urgency u : Urgency.values()) {
            if (u.isReportable() && u.label().equals(label)) return true;
        }
        return false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
