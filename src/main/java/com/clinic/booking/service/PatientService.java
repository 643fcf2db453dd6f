package com.clinic.booking.service;

import com.clinic.booking.entity.Patient;
import com.clinic.booking.repository.PatientRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Patient lookup by phone (or phone/email) with create-or-refresh on booking.
 */
@Service
public class PatientService {

    private static final Logger log = LoggerFactory.getLogger(PatientService.class);

    private final PatientRepository patientRepository;

    public PatientService(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    /**
     * Strips dashes and whitespace.
     */
    public static String normalizePhone(String phone) {
        return StringUtils.remove(StringUtils.deleteWhitespace(StringUtils.defaultString(phone)), '-');
    }

    /**
     * Domestic numbers: a leading zero followed by 9 or 10 digits.
     */
    public static boolean isValidPhone(String normalized) {
        return normalized != null && normalized.matches("0\\d{9,10}");
    }

    @Transactional
    public Patient findOrCreate(String name, String kana, String phone, String email, String address) {
        String cleanPhone = normalizePhone(phone);
        String cleanEmail = StringUtils.trimToNull(email);
        String cleanAddress = StringUtils.trimToNull(address);

        Optional<Patient> existing = cleanEmail == null
                ? patientRepository.findFirstByPhoneOrderByIdAsc(cleanPhone)
                : patientRepository.findFirstByPhoneOrEmailOrderByIdAsc(cleanPhone, cleanEmail);

        if (existing.isPresent()) {
            Patient patient = existing.get();
            patient.setName(StringUtils.trim(name));
            patient.setKana(StringUtils.trimToEmpty(kana));
            if (cleanEmail != null) patient.setEmail(cleanEmail);
            if (cleanAddress != null) patient.setAddress(cleanAddress);
            return patientRepository.save(patient);
        }

        Patient created = patientRepository.save(Patient.builder()
                .name(StringUtils.trim(name))
                .kana(StringUtils.trimToEmpty(kana))
                .phone(cleanPhone)
                .email(cleanEmail)
                .address(cleanAddress)
                .build());
        log.info("Registered patient {}", created.getId());
        return created;
    }

    /**
     * Phone bookings without a number always get a fresh patient row.
     */
    @Transactional
    public Patient forPhoneBooking(String name, String kana, String phone) {
        if (StringUtils.isBlank(phone)) {
            return patientRepository.save(Patient.builder()
                    .name(StringUtils.trim(name))
                    .kana(StringUtils.trimToEmpty(kana))
                    .phone("")
                    .build());
        }
        return findOrCreate(name, kana, phone, null, null);
    }
}
