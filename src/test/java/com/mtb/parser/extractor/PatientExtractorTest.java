package com.mtb.parser.extractor;

import com.mtb.parser.model.PatientRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatientExtractor
 */
public class PatientExtractorTest {

    private PatientExtractor extractor;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-10-22T09:00:00Z"), ZoneOffset.UTC);
        extractor = new PatientExtractor(clock);
    }

    @Test
    public void testExtract_HeaderFields() {
        PatientRecord patient = extractor.extract("ID Paziente: 12345\nEtà: 65 anni\nSesso: M");

        assertEquals("12345", patient.getId());
        assertEquals(65, patient.getAge());
        assertEquals("M", patient.getSex());
        assertNull(patient.getBirthDate());
        assertTrue(patient.isComplete());
    }

    @Test
    public void testExtract_NarrativeWithBirthDate() {
        PatientRecord patient = extractor.extract("Paziente N1 maschio, nato il 05/06/1960, fumatore.");

        assertEquals("N1", patient.getId());
        assertEquals("M", patient.getSex());
        assertEquals("1960-06-05", patient.getBirthDate());
        assertEquals(65, patient.getAge());
    }

    @Test
    public void testExtract_EnglishHeader() {
        PatientRecord patient = extractor.extract("ID: AB12\nAge: 54\nSex: Female\nDate of birth: 1.2.1971");

        assertEquals("AB12", patient.getId());
        assertEquals(54, patient.getAge());
        assertEquals("F", patient.getSex());
        assertEquals("1971-02-01", patient.getBirthDate());
    }

    @Test
    public void testExtract_ImplausibleAgeSkipped() {
        PatientRecord patient = extractor.extract("Età: 150\nPaziente di 70 anni");

        assertEquals(70, patient.getAge());
    }

    @Test
    public void testExtract_Empty() {
        assertEquals(PatientRecord.empty(), extractor.extract(""));
    }

    // ========== Age Derivation Tests ==========

    @Test
    public void testAgeFromBirthDate() {
        assertEquals(67, extractor.ageFromBirthDate("1958-03-15"));
        assertEquals(66, extractor.ageFromBirthDate("1958-10-23"));
    }

    @Test
    public void testAgeFromBirthDate_NotACalendarDate() {
        assertNull(extractor.ageFromBirthDate("2024-02-31"));
    }

    @Test
    public void testAgeFromBirthDate_Implausible() {
        assertNull(extractor.ageFromBirthDate("1850-01-01"));
        assertNull(extractor.ageFromBirthDate("2030-01-01"));
    }
}
