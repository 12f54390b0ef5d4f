package uk.gegc.readingplan.features.student.application;

import java.util.List;

/**
 * Generation context for a student: everything the content generator may see.
 *
 * @param age whole years, clamped to the supported reading range
 */
public record StudentProfile(
        Long id,
        String name,
        int age,
        Integer gradeLevel,
        List<String> interests
) {
}
