package uk.gegc.readingplan.features.student.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.readingplan.features.student.application.StudentProfile;
import uk.gegc.readingplan.features.student.domain.model.Student;
import uk.gegc.readingplan.features.student.domain.repository.StudentRepository;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StudentDirectoryImpl Tests")
class StudentDirectoryImplTest {

    @Mock
    private StudentRepository studentRepository;

    private StudentDirectoryImpl studentDirectory;

    @BeforeEach
    void setUp() {
        studentDirectory = new StudentDirectoryImpl(studentRepository,
                Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private Student student(LocalDate birthday, String interests) {
        Student student = new Student();
        student.setId(7L);
        student.setName("Mia");
        student.setAccountUsername("parent");
        student.setBirthday(birthday);
        student.setGradeLevel(3);
        student.setInterests(interests);
        return student;
    }

    @Test
    @DisplayName("getOwnedStudent: when owned by another account then not found")
    void getOwnedStudent_otherAccount_thenNotFound() {
        // Given
        when(studentRepository.findByIdAndAccountUsername(7L, "intruder")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> studentDirectory.getOwnedStudent(7L, "intruder"))
                .isInstanceOf(ResourceNotFoundException.class)
                .satisfies(e -> assertThat(((ResourceNotFoundException) e).getErrorCode())
                        .isEqualTo(ErrorCode.STUDENT_NOT_FOUND));
    }

    @Test
    @DisplayName("toProfile: computes age from birthday and splits interests")
    void toProfile_computesAgeAndInterests() {
        // When
        StudentProfile profile = studentDirectory.toProfile(student(LocalDate.of(2015, 6, 1), "space, dinosaurs ,,"));

        // Then
        assertThat(profile.age()).isEqualTo(8);
        assertThat(profile.interests()).containsExactly("space", "dinosaurs");
        assertThat(profile.gradeLevel()).isEqualTo(3);
    }

    @Test
    @DisplayName("toProfile: when birthday missing then default age")
    void toProfile_noBirthday_thenDefaultAge() {
        assertThat(studentDirectory.toProfile(student(null, null)).age()).isEqualTo(StudentDirectoryImpl.DEFAULT_AGE);
    }

    @Test
    @DisplayName("toProfile: when age outside reading range then clamped")
    void toProfile_outOfRange_thenClamped() {
        assertThat(studentDirectory.toProfile(student(LocalDate.of(2022, 1, 1), null)).age())
                .isEqualTo(StudentDirectoryImpl.MIN_AGE);
        assertThat(studentDirectory.toProfile(student(LocalDate.of(1990, 1, 1), null)).age())
                .isEqualTo(StudentDirectoryImpl.MAX_AGE);
    }
}
