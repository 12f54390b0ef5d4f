package uk.gegc.readingplan.features.student.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Student profile owned by a parent account. Maintained by the account service;
 * this application only reads it.
 */
@Entity
@Table(name = "students")
@Getter
@Setter
@NoArgsConstructor
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_username", nullable = false, length = 100)
    private String accountUsername;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "birthday")
    private LocalDate birthday;

    @Column(name = "grade_level")
    private Integer gradeLevel;

    @Column(name = "interests", length = 500)
    private String interests;
}
