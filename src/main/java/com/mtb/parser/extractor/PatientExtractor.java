package com.mtb.parser.extractor;

import com.mtb.parser.model.PatientRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts patient demographics. For each field the first matching pattern wins.
 */
public class PatientExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PatientExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String DATE = "(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{4})";

    private static final List<Pattern> ID_PATTERNS = List.of(
        Pattern.compile("ID\\s+Paziente[:\\s]+([A-Z0-9]+)", FLAGS),
        Pattern.compile("Paziente\\s+([A-Z]\\d+)\\s+", FLAGS),
        Pattern.compile("Paziente\\s*[:\\s]*([A-Z0-9]+)", FLAGS),
        Pattern.compile("\\bID[:\\s]+([A-Z0-9]+)", FLAGS)
    );

    private static final List<Pattern> AGE_PATTERNS = List.of(
        Pattern.compile("\\bEtà[:\\s]+(\\d{1,3})\\b", FLAGS),
        Pattern.compile("\\bAge[:\\s]+(\\d{1,3})\\b", FLAGS),
        Pattern.compile("\\b([1-9]\\d{0,2})\\s+anni\\b", FLAGS),
        Pattern.compile("\\b([1-9]\\d{0,2})\\s+years\\b", FLAGS)
    );

    private static final List<Pattern> SEX_PATTERNS = List.of(
        Pattern.compile("Sesso[:\\s]+(Maschio|Femmina|Male|Female|M|F)\\b", FLAGS),
        Pattern.compile("Sex[:\\s]+(Male|Female|M|F)\\b", FLAGS),
        Pattern.compile("Gender[:\\s]+(Male|Female|M|F)\\b", FLAGS),
        // "Paziente N1 maschio"
        Pattern.compile("paziente\\s+(?:[A-Z0-9]+\\s+)?(maschio|femmina)\\b", FLAGS)
    );

    private static final List<Pattern> BIRTH_DATE_PATTERNS = List.of(
        Pattern.compile("Data\\s+di\\s+nascita[:\\s]+" + DATE, FLAGS),
        Pattern.compile("Date\\s+of\\s+birth[:\\s]+" + DATE, FLAGS),
        Pattern.compile("nat[oa]\\s+il[:\\s]+" + DATE, FLAGS)
    );

    private final Clock clock;

    /**
     * @param clock Clock supplying "today" for age derivation
     */
    public PatientExtractor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Extract patient demographics
     * @param text Preprocessed report text
     * @return Patient record, with null for every field not found
     */
    public PatientRecord extract(String text) {
        if (text == null || text.isEmpty()) {
            return PatientRecord.empty();
        }

        String id = Patterns.firstGroup(ID_PATTERNS, text).orElse(null);
        Integer age = extractAge(text);
        String sex = Patterns.firstGroup(SEX_PATTERNS, text).map(Normalizer::normalizeSex).orElse(null);
        String birthDate = Patterns.firstGroup(BIRTH_DATE_PATTERNS, text).map(Normalizer::normalizeDate).orElse(null);

        if (age == null && birthDate != null) {
            age = ageFromBirthDate(birthDate);
        }

        return new PatientRecord(id, age, sex, birthDate);
    }

    private Integer extractAge(String text) {
        for (Pattern pattern : AGE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int age = Integer.parseInt(matcher.group(1));
                if (age >= PatientRecord.MIN_AGE && age <= PatientRecord.MAX_AGE) {
                    return age;
                }
                logger.debug("Ignoring implausible age {}", age);
            }
        }
        return null;
    }

    /**
     * Whole years between an ISO birth date and today
     * @param isoBirthDate Birth date as YYYY-MM-DD
     * @return Age, or null if the date is not a real calendar date or the age is implausible
     */
    Integer ageFromBirthDate(String isoBirthDate) {
        try {
            LocalDate birth = LocalDate.parse(isoBirthDate);
            int years = Period.between(birth, LocalDate.now(clock)).getYears();
            if (years < PatientRecord.MIN_AGE || years > PatientRecord.MAX_AGE) {
                logger.debug("Birth date {} gives implausible age {}", isoBirthDate, years);
                return null;
            }
            return years;
        } catch (DateTimeParseException e) {
            logger.debug("Cannot derive age from birth date '{}': {}", isoBirthDate, e.getMessage());
            return null;
        }
    }
}
