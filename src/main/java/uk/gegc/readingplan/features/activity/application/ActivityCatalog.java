package uk.gegc.readingplan.features.activity.application;

import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed set of activities per plan variant, and the wording shown for each day.
 *
 * <p>Every day of a plan offers the same six types. Three-day plans offer vocabulary as an
 * optional extra; five-day plans require all six.
 */
@Component
public class ActivityCatalog {

    private static final List<ActivityType> ALL_TYPES = List.of(
            ActivityType.WHO,
            ActivityType.WHERE,
            ActivityType.SEQUENCE,
            ActivityType.MAIN_IDEA,
            ActivityType.VOCABULARY,
            ActivityType.PREDICT
    );

    private static final Set<ActivityType> THREE_DAY_REQUIRED = EnumSet.of(
            ActivityType.WHO,
            ActivityType.WHERE,
            ActivityType.SEQUENCE,
            ActivityType.MAIN_IDEA,
            ActivityType.PREDICT
    );

    public List<ActivityType> offeredTypes() {
        return ALL_TYPES;
    }

    public Set<ActivityType> requiredTypes(PlanVariant variant) {
        return switch (variant) {
            case THREE_DAY -> EnumSet.copyOf(THREE_DAY_REQUIRED);
            case FIVE_DAY -> EnumSet.copyOf(ALL_TYPES);
        };
    }

    public ActivityDescriptor describe(ActivityType type, int dayIndex, int totalDays) {
        String chapter = "Chapter " + dayIndex;
        boolean lastDay = dayIndex >= totalDays;
        return switch (type) {
            case WHO -> new ActivityDescriptor(
                    "Who Activity",
                    "Who are the characters in " + chapter + "?",
                    "Pick the characters who really appear in the chapter.");
            case WHERE -> new ActivityDescriptor(
                    "Where Activity",
                    "Where does " + chapter + " take place?",
                    "Describe the setting in at least 10 characters.");
            case SEQUENCE -> new ActivityDescriptor(
                    "Sequence Activity",
                    "What happened in " + chapter + "? Put the events in order.",
                    "Arrange the event cards in the order they happened.");
            case MAIN_IDEA -> new ActivityDescriptor(
                    "Main Idea Activity",
                    "What is the main idea of " + chapter + "?",
                    "Choose the option that best describes the main idea.");
            case VOCABULARY -> new ActivityDescriptor(
                    "Vocabulary Activity",
                    "Match the words from " + chapter + " with their meanings.",
                    "Every word must be matched with its correct definition.");
            case PREDICT -> new ActivityDescriptor(
                    "Predict Activity",
                    lastDay
                            ? "What do you think happens after the story ends?"
                            : "What do you think will happen in Chapter " + (dayIndex + 1) + "?",
                    "Choose the prediction you think is most likely.");
        };
    }

    public record ActivityDescriptor(String title, String prompt, String description) {
    }
}
