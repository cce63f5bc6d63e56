package com.firstcrack.domain.stage;

import com.firstcrack.domain.action.ActionId;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable brew stage table.
 *
 * Invariants checked at construction:
 * - at least one stage
 * - each stage id appears once, in lifecycle order
 * - offsets strictly increase
 *
 * Timing of the standard timeline:
 * <pre>
 *  heating        0s
 *  grinding      20s
 *  pre_infusion  30s
 *  brewing       45s
 *  complete      75s
 * </pre>
 */
public final class StageTimeline {

    private static final StageTimeline STANDARD = new StageTimeline(List.of(
        new StageEntry(
            StageId.HEATING,
            0,
            "Heating Water",
            "Your espresso machine is heating to the perfect temperature...",
            MediaRef.image("/images/heating.png"),
            List.of(),
            0,
            false,
            false),
        new StageEntry(
            StageId.GRINDING,
            20,
            "Grinding Beans",
            "Grinding fresh coffee beans to the perfect particle size...",
            MediaRef.image("/images/grinding.png"),
            List.of(ActionId.PAUSE_GRINDING, ActionId.ADJUST_GRIND),
            40,
            false,
            false),
        new StageEntry(
            StageId.PRE_INFUSION,
            30,
            "Pre-infusion",
            "Gently saturating the coffee puck at 2 bar...",
            MediaRef.image("/images/pre_infusion.png"),
            List.of(ActionId.SKIP_PREINFUSION, ActionId.EXTEND_PREINFUSION),
            60,
            true,
            false),
        new StageEntry(
            StageId.BREWING,
            45,
            "Brewing",
            "Extracting espresso at 9 bar. Beautiful crema forming...",
            MediaRef.imageAndVideo("/images/brewing.png", "/videos/extraction-live.mp4"),
            List.of(ActionId.STOP_SHOT, ActionId.VIEW_LIVE),
            80,
            true,
            false),
        new StageEntry(
            StageId.COMPLETE,
            75,
            "Your Espresso is Ready! ☕",
            "Perfect extraction: 36ml in 28s at 93°C. Enjoy!",
            MediaRef.image("/images/brew_complete.png"),
            List.of(ActionId.BREW_AGAIN, ActionId.ADJUST_PROFILE, ActionId.SHARE),
            100,
            true,
            true)
    ));

    private final List<StageEntry> entries;

    public StageTimeline(List<StageEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Timeline needs at least one stage");
        }
        Set<StageId> seen = EnumSet.noneOf(StageId.class);
        StageEntry previous = null;
        for (StageEntry entry : entries) {
            if (entry == null) {
                throw new IllegalArgumentException("Timeline contains a null stage");
            }
            if (!seen.add(entry.stageId())) {
                throw new IllegalArgumentException("Duplicate stage in timeline: " + entry.stageId());
            }
            if (previous != null) {
                if (!previous.stageId().isBefore(entry.stageId())) {
                    throw new IllegalArgumentException(String.format(
                        "Stage %s listed after %s", entry.stageId(), previous.stageId()));
                }
                if (entry.offsetSeconds() <= previous.offsetSeconds()) {
                    throw new IllegalArgumentException(String.format(
                        "Offset of %s (%ds) must be greater than offset of %s (%ds)",
                        entry.stageId(), entry.offsetSeconds(),
                        previous.stageId(), previous.offsetSeconds()));
                }
            }
            previous = entry;
        }
        this.entries = List.copyOf(entries);
    }

    public static StageTimeline standard() {
        return STANDARD;
    }

    public List<StageEntry> entries() {
        return entries;
    }

    public int stageCount() {
        return entries.size();
    }

    /**
     * Offset of the final stage; the brew is over once it has fired.
     */
    public int totalDurationSeconds() {
        return entries.get(entries.size() - 1).offsetSeconds();
    }

    public Optional<StageEntry> find(StageId stageId) {
        return entries.stream().filter(e -> e.stageId() == stageId).findFirst();
    }
}
