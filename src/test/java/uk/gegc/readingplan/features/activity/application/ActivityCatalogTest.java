package uk.gegc.readingplan.features.activity.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ActivityCatalog Tests")
class ActivityCatalogTest {

    private final ActivityCatalog catalog = new ActivityCatalog();

    @Test
    @DisplayName("requiredTypes: three-day plans do not require vocabulary")
    void requiredTypes_threeDay_excludesVocabulary() {
        assertThat(catalog.requiredTypes(PlanVariant.THREE_DAY))
                .containsExactlyInAnyOrder(ActivityType.WHO, ActivityType.WHERE, ActivityType.SEQUENCE,
                        ActivityType.MAIN_IDEA, ActivityType.PREDICT);
    }

    @Test
    @DisplayName("requiredTypes: five-day plans require all six types")
    void requiredTypes_fiveDay_requiresAll() {
        assertThat(catalog.requiredTypes(PlanVariant.FIVE_DAY)).containsExactlyInAnyOrder(ActivityType.values());
    }

    @Test
    @DisplayName("requiredTypes: returned set can be modified without affecting the catalog")
    void requiredTypes_returnsCopy() {
        // Given
        catalog.requiredTypes(PlanVariant.THREE_DAY).clear();

        // Then
        assertThat(catalog.requiredTypes(PlanVariant.THREE_DAY)).hasSize(5);
    }

    @Test
    @DisplayName("offeredTypes: every day offers all six types in display order")
    void offeredTypes_allTypesInOrder() {
        assertThat(catalog.offeredTypes()).containsExactly(
                ActivityType.WHO, ActivityType.WHERE, ActivityType.SEQUENCE,
                ActivityType.MAIN_IDEA, ActivityType.VOCABULARY, ActivityType.PREDICT);
    }

    @Test
    @DisplayName("describe: predict prompt names the next chapter before the last day")
    void describe_predictBeforeLastDay_namesNextChapter() {
        assertThat(catalog.describe(ActivityType.PREDICT, 2, 3).prompt()).contains("Chapter 3");
    }

    @Test
    @DisplayName("describe: predict prompt asks about the ending on the last day")
    void describe_predictOnLastDay_asksAboutEnding() {
        assertThat(catalog.describe(ActivityType.PREDICT, 3, 3).prompt()).contains("after the story ends");
    }
}
