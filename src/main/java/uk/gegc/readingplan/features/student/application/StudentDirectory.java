package uk.gegc.readingplan.features.student.application;

import uk.gegc.readingplan.features.student.domain.model.Student;

public interface StudentDirectory {

    /**
     * Loads a student that belongs to the given account.
     *
     * @throws uk.gegc.readingplan.shared.exception.ResourceNotFoundException with
     *         {@code STUDENT_NOT_FOUND} when the student is absent or owned by another account
     */
    Student getOwnedStudent(Long studentId, String accountUsername);

    StudentProfile toProfile(Student student);
}
