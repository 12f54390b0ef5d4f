package uk.gegc.readingplan.features.activity.application;

import uk.gegc.readingplan.features.student.application.StudentProfile;

/**
 * Inputs the generator needs for one day's activities.
 */
public record ActivityGenerationContext(StudentProfile student, String chapterText) {
}
