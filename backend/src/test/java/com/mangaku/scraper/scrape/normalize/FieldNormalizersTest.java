package com.mangaku.scraper.scrape.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizersTest {

    @Test
    void viewsHandlesSeparatorsAndMagnitudeSuffixes() {
        assertThat(FieldNormalizers.views("12,345")).isEqualTo(12_345L);
        assertThat(FieldNormalizers.views("3.5K")).isEqualTo(3_500L);
        assertThat(FieldNormalizers.views("2M")).isEqualTo(2_000_000L);
        assertThat(FieldNormalizers.views("1.5m")).isEqualTo(1_500_000L);
        assertThat(FieldNormalizers.views("12k views")).isEqualTo(12_000L);
    }

    @Test
    void viewsDefaultsToZero() {
        assertThat(FieldNormalizers.views("")).isZero();
        assertThat(FieldNormalizers.views("-")).isZero();
        assertThat(FieldNormalizers.views(null)).isZero();
        assertThat(FieldNormalizers.views("n/a")).isZero();
        assertThat(FieldNormalizers.views("99999999999999999999999")).isZero();
    }

    @Test
    void ratingIsNeverNegativeOrUnparsed() {
        assertThat(FieldNormalizers.rating("8.75")).isEqualTo(8.75d);
        assertThat(FieldNormalizers.rating(" 7 ")).isEqualTo(7.0d);
        assertThat(FieldNormalizers.rating("-")).isZero();
        assertThat(FieldNormalizers.rating("")).isZero();
        assertThat(FieldNormalizers.rating(null)).isZero();
        assertThat(FieldNormalizers.rating("great")).isZero();
        assertThat(FieldNormalizers.rating("-3")).isZero();
        assertThat(FieldNormalizers.rating("NaN")).isZero();
    }

    @Test
    void firstIntTakesLeadingDigitRun() {
        assertThat(FieldNormalizers.firstInt("Chapter 120 End")).isEqualTo(120);
        assertThat(FieldNormalizers.firstInt("Ch.7 - 8")).isEqualTo(7);
        assertThat(FieldNormalizers.firstInt("Oneshot")).isZero();
        assertThat(FieldNormalizers.firstInt(null)).isZero();
    }

    @Test
    void yearChecksCandidatesInOrderThenFallsBack() {
        assertThat(FieldNormalizers.year(2025, "March 5, 2021", "January 2, 2024")).isEqualTo(2021);
        assertThat(FieldNormalizers.year(2025, null, "January 2, 2024")).isEqualTo(2024);
        assertThat(FieldNormalizers.year(2025, "recently", null)).isEqualTo(2025);
        assertThat(FieldNormalizers.year(1999)).isEqualTo(1999);
    }

    @Test
    void truncateAppendsEllipsisOnlyWhenTooLong() {
        String exact = "a".repeat(100);
        String longer = "b".repeat(101);

        assertThat(FieldNormalizers.truncate(exact, 100)).isEqualTo(exact);
        assertThat(FieldNormalizers.truncate(longer, 100)).isEqualTo("b".repeat(100) + "...");
        assertThat(FieldNormalizers.truncate(null, 100)).isEmpty();
    }

    @Test
    void collapseWhitespaceFlattensBlocks() {
        assertThat(FieldNormalizers.collapseWhitespace("  Status \n\t Ongoing   Type\nManhwa "))
            .isEqualTo("Status Ongoing Type Manhwa");
    }
}
