package com.fillline.scheduler;

import com.fillline.scheduler.domain.Activity;
import com.fillline.scheduler.domain.ActivityKind;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.RawLotRecord;
import com.fillline.scheduler.domain.SchedulerConfig;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared lots and hand-built activities for tests.
 */
public final class Fixtures {

    public static final LocalDateTime START = LocalDateTime.of(2025, 1, 1, 8, 0);

    /** Default line rules at 1,000 vials per hour, so vial counts read as thousandths of an hour. */
    public static final SchedulerConfig ROUND_RATE = SchedulerConfig.builder()
            .fillRateVialsPerHour(1_000.0)
            .build();

    private static final String[] TYPES = {"Solution", "Suspension", "Powder"};

    private Fixtures() {
    }

    /** Lots A, B (Solution) and C (Suspension) at the default 19,920 vials per hour. */
    public static List<Lot> threeLots() {
        SchedulerConfig config = SchedulerConfig.defaults();
        return List.of(
                Lot.of("A", "Solution", 1_000_000, config),
                Lot.of("B", "Solution", 500_000, config),
                Lot.of("C", "Suspension", 2_000_000, config));
    }

    public static List<RawLotRecord> threeRecords() {
        return List.of(
                record("A", "Solution", "1000000"),
                record("B", "Solution", "500000"),
                record("C", "Suspension", "2000000"));
    }

    /** Two 60 h and two 10 h lots of one type. SPT and LPT both need two clean blocks, 196 h in all. */
    public static List<Lot> bigAndSmall() {
        return List.of(
                lot("L1", "X", 60),
                lot("L2", "X", 60),
                lot("L3", "X", 10),
                lot("L4", "X", 10));
    }

    /**
     * S1 (50 h X), S2 (60 h Y), S3 (15 h X). SPT packs S3 and S1 together and finishes at 177 h;
     * LPT opens with S2, fills S1 behind it and needs a third clean for S3, finishing at 181 h.
     */
    public static List<Lot> shortFirstWins() {
        return List.of(
                lot("S1", "X", 50),
                lot("S2", "Y", 60),
                lot("S3", "X", 15));
    }

    /**
     * P1 (30 h Y), P2 (40 h Y), P3 (60 h X), P4 (75 h Y). SPT needs three clean blocks (281 h) and
     * LPT three as well (285 h); pairing P4 with P2 and P3 with P1 fits two blocks in 265 h.
     */
    public static List<Lot> pairingMatters() {
        return List.of(
                lot("P1", "Y", 30),
                lot("P2", "Y", 40),
                lot("P3", "X", 60),
                lot("P4", "Y", 75));
    }

    public static Lot lot(String id, String type, double fillHours) {
        return Lot.of(id, type, Math.round(fillHours * 1_000), ROUND_RATE);
    }

    public static RawLotRecord record(String id, String type, String vials) {
        return RawLotRecord.builder().id(id).type(type).vialCount(vials).build();
    }

    public static List<Lot> randomLots(Random random, SchedulerConfig config) {
        int n = 1 + random.nextInt(12);
        List<Lot> lots = new ArrayList<>(n);
        long maxVials = (long) (config.windowCapacityHours() * config.getFillRateVialsPerHour());
        for (int i = 0; i < n; i++) {
            long vials = 1 + (long) (random.nextDouble() * maxVials);
            lots.add(Lot.of(String.format("LOT-%02d", i), TYPES[random.nextInt(TYPES.length)], vials, config));
        }
        return lots;
    }

    public static LocalDateTime at(double hours) {
        return START.plusNanos(Math.round(hours * 3_600_000_000_000.0));
    }

    public static Activity clean(double from, double to) {
        return Activity.builder().kind(ActivityKind.CLEAN).start(at(from)).end(at(to)).lineId("LINE-1").build();
    }

    public static Activity fill(String lotId, String type, double from, double to) {
        return Activity.builder().kind(ActivityKind.FILL).start(at(from)).end(at(to)).lineId("LINE-1")
                .lotId(lotId).lotType(type).build();
    }

    public static Activity changeover(String from, String to, double start, double end) {
        return Activity.builder().kind(ActivityKind.CHANGEOVER).start(at(start)).end(at(end)).lineId("LINE-1")
                .previousType(from).lotType(to).build();
    }
}
