package com.mtb.parser.model;

import java.util.Objects;

/**
 * Patient demographics extracted from the report header.
 * All fields are optional; birth date is kept as the ISO string produced by
 * day-first normalization and is not validated as a calendar date.
 */
public final class PatientRecord {
    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 120;

    private final String id;
    private final Integer age;
    private final String sex;
    private final String birthDate;

    public PatientRecord(String id, Integer age, String sex, String birthDate) {
        if (age != null && (age < MIN_AGE || age > MAX_AGE)) {
            throw new IllegalArgumentException("Age out of range: " + age);
        }
        this.id = id;
        this.age = age;
        this.sex = sex;
        this.birthDate = birthDate;
    }

    public static PatientRecord empty() {
        return new PatientRecord(null, null, null, null);
    }

    /**
     * Check if patient has all required fields
     * @return true if id, age and sex are all present
     */
    public boolean isComplete() {
        return id != null && age != null && sex != null;
    }

    public String getId() {
        return id;
    }

    public Integer getAge() {
        return age;
    }

    /** Normalized sex code: "M", "F", or the uppercased source value when unmapped. */
    public String getSex() {
        return sex;
    }

    public Sex getSexCategory() {
        return Sex.fromCode(sex);
    }

    public String getBirthDate() {
        return birthDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatientRecord)) {
            return false;
        }
        PatientRecord other = (PatientRecord) o;
        return Objects.equals(id, other.id) && Objects.equals(age, other.age)
            && Objects.equals(sex, other.sex) && Objects.equals(birthDate, other.birthDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, age, sex, birthDate);
    }

    @Override
    public String toString() {
        return "PatientRecord{id=" + id + ", age=" + age + ", sex=" + sex + ", birthDate=" + birthDate + "}";
    }
}
