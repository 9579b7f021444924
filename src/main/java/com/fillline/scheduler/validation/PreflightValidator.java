package com.fillline.scheduler.validation;

import com.fillline.scheduler.domain.IssueCode;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.LotIssue;
import com.fillline.scheduler.domain.PreflightReport;
import com.fillline.scheduler.domain.RawLotRecord;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.engine.RuleEngine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw lot records into validated lots. Collects every problem instead of stopping at the
 * first, so a whole input file can be fixed in one pass. Records with errors produce no lot;
 * a repeated id keeps its first occurrence.
 */
@Component
public class PreflightValidator {

    public PreflightReport validate(List<RawLotRecord> records, SchedulerConfig config) {
        List<Lot> lots = new ArrayList<>();
        List<LotIssue> errors = new ArrayList<>();
        List<LotIssue> warnings = new ArrayList<>();

        checkConfig(config, errors);
        boolean configUsable = errors.isEmpty();
        double capacity = config.windowCapacityHours();

        Set<String> seenIds = new HashSet<>();
        for (int row = 0; row < records.size(); row++) {
            RawLotRecord record = records.get(row);
            if (record == null) {
                errors.add(new LotIssue(IssueCode.BLANK_ID, row, null, "Row " + row + " is empty."));
                continue;
            }
            String id = trim(record.getId());
            String type = trim(record.getType());
            String label = id.isEmpty() ? "(row " + row + ")" : id;
            int errorsBefore = errors.size();

            if (id.isEmpty()) {
                errors.add(new LotIssue(IssueCode.BLANK_ID, row, null, "Row " + row + " has an empty lot id."));
            }
            if (type.isEmpty()) {
                errors.add(new LotIssue(IssueCode.BLANK_TYPE, row, nullIfEmpty(id),
                        "Lot " + label + " has an empty type."));
            }

            Long vials = parseVialCount(record.getVialCount(), row, id, label, errors);
            if (vials != null && configUsable) {
                double fillHours = vials / config.getFillRateVialsPerHour();
                if (RuleEngine.isOversize(fillHours, config)) {
                    long maxVials = (long) Math.floor(capacity * config.getFillRateVialsPerHour());
                    errors.add(new LotIssue(IssueCode.OVERSIZE_LOT, row, nullIfEmpty(id), String.format(Locale.ROOT,
                            "Lot %s: %,d vials (~%.2f h) exceeds the %s h clean window. Max vials per lot at current rate: %,d.",
                            label, vials, fillHours, formatHours(capacity), maxVials)));
                }
            }

            if (!id.isEmpty() && !seenIds.add(id)) {
                LotIssue duplicate = new LotIssue(IssueCode.DUPLICATE_ID, row, id, "Duplicate lot id detected: " + id);
                if (config.isStrictDuplicateIds()) {
                    errors.add(duplicate);
                } else {
                    warnings.add(duplicate);
                }
                continue;
            }

            if (errors.size() == errorsBefore && configUsable) {
                lots.add(Lot.of(id, type, vials, config));
            }
        }
        return new PreflightReport(lots, errors, warnings);
    }

    private static void checkConfig(SchedulerConfig config, List<LotIssue> errors) {
        if (config.getFillRateVialsPerHour() <= 0) {
            errors.add(configIssue("Fill rate must be > 0 vials/hour."));
        }
        if (config.getWindowHours() <= 0) {
            errors.add(configIssue("Window hours must be > 0."));
        }
        if (config.getCleanHours() <= 0) {
            errors.add(configIssue("Clean hours must be > 0."));
        }
        if (config.getChangeoverSameHours() < 0 || config.getChangeoverDiffHours() < 0) {
            errors.add(configIssue("Changeover hours cannot be negative."));
        }
        if (config.getWindowHours() > 0 && config.windowCapacityHours() <= 0) {
            errors.add(configIssue("Clean hours leave no room in the window when cleans count toward it."));
        }
        if (config.getBeamWidth() < 1 || config.getLookaheadHorizon() < 1) {
            errors.add(configIssue("Beam width and look-ahead horizon must be at least 1."));
        }
        if (config.getMilpMaxLots() < 1 || config.getMilpTimeLimitSeconds() <= 0) {
            errors.add(configIssue("MILP lot limit must be at least 1 and its time limit > 0."));
        }
    }

    private static Long parseVialCount(String raw, int row, String id, String label, List<LotIssue> errors) {
        String text = trim(raw);
        if (text.isEmpty()) {
            errors.add(new LotIssue(IssueCode.MISSING_VIAL_COUNT, row, nullIfEmpty(id),
                    "Lot " + label + " has no vial count."));
            return null;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(text);
        } catch (NumberFormatException e) {
            errors.add(new LotIssue(IssueCode.NON_NUMERIC_VIAL_COUNT, row, nullIfEmpty(id),
                    "Lot " + label + ": vial count '" + text + "' is not a number."));
            return null;
        }
        if (value.signum() <= 0) {
            errors.add(new LotIssue(IssueCode.NON_POSITIVE_VIAL_COUNT, row, nullIfEmpty(id),
                    "Lot " + label + ": vials must be a positive integer (got " + text + ")."));
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            errors.add(new LotIssue(IssueCode.NON_NUMERIC_VIAL_COUNT, row, nullIfEmpty(id),
                    "Lot " + label + ": vial count '" + text + "' is not a whole number."));
            return null;
        }
    }

    private static LotIssue configIssue(String message) {
        return new LotIssue(IssueCode.INVALID_CONFIG, -1, null, "Config: " + message);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static String nullIfEmpty(String value) {
        return value.isEmpty() ? null : value;
    }

    private static String formatHours(double hours) {
        return hours == Math.rint(hours) ? String.valueOf((long) hours) : String.valueOf(hours);
    }
}
