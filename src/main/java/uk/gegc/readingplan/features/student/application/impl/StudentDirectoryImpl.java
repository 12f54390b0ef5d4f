package uk.gegc.readingplan.features.student.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readingplan.features.student.application.StudentDirectory;
import uk.gegc.readingplan.features.student.application.StudentProfile;
import uk.gegc.readingplan.features.student.domain.model.Student;
import uk.gegc.readingplan.features.student.domain.repository.StudentRepository;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.Arrays;
import java.util.List;

@Service
@RequiredArgsConstructor
public class StudentDirectoryImpl implements StudentDirectory {

    static final int MIN_AGE = 5;
    static final int MAX_AGE = 18;
    static final int DEFAULT_AGE = 8;

    private final StudentRepository studentRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Student getOwnedStudent(Long studentId, String accountUsername) {
        return studentRepository.findByIdAndAccountUsername(studentId, accountUsername)
                .orElseThrow(() -> new ResourceNotFoundException(
                        ErrorCode.STUDENT_NOT_FOUND, "Student " + studentId + " not found"));
    }

    @Override
    public StudentProfile toProfile(Student student) {
        return new StudentProfile(
                student.getId(),
                student.getName(),
                ageOf(student.getBirthday()),
                student.getGradeLevel(),
                parseInterests(student.getInterests())
        );
    }

    private int ageOf(LocalDate birthday) {
        if (birthday == null) {
            return DEFAULT_AGE;
        }
        int years = Period.between(birthday, LocalDate.now(clock)).getYears();
        return Math.max(MIN_AGE, Math.min(MAX_AGE, years));
    }

    private List<String> parseInterests(String interests) {
        if (interests == null || interests.isBlank()) {
            return List.of();
        }
        return Arrays.stream(interests.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
