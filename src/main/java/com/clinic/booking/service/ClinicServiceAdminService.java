package com.clinic.booking.service;

import com.clinic.booking.dto.ClinicServiceRequest;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.ClinicServiceRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Admin maintenance of the treatment menu. Entries that were ever booked can
 * only be deactivated, never deleted.
 */
@Service
public class ClinicServiceAdminService {

    private static final Logger log = LoggerFactory.getLogger(ClinicServiceAdminService.class);

    static final String NAME_AND_DURATION_REQUIRED = "name and durationMinutes are required";
    static final String HAS_APPOINTMENTS = "This service has appointments and cannot be deleted. Deactivate it instead.";

    private final ClinicServiceRepository serviceRepository;
    private final AppointmentRepository appointmentRepository;

    public ClinicServiceAdminService(ClinicServiceRepository serviceRepository,
                                     AppointmentRepository appointmentRepository) {
        this.serviceRepository = serviceRepository;
        this.appointmentRepository = appointmentRepository;
    }

    /** Active and inactive entries, in display order. */
    @Transactional(readOnly = true)
    public List<ClinicService> list() {
        return serviceRepository.findAllByOrderBySortOrderAscIdAsc();
    }

    @Transactional
    public ClinicService create(ClinicServiceRequest request) {
        if (StringUtils.isBlank(request.getName()) || request.getDurationMinutes() == null) {
            throw new IllegalArgumentException(NAME_AND_DURATION_REQUIRED);
        }
        ClinicService saved = serviceRepository.save(ClinicService.builder()
                .name(request.getName().trim())
                .description(StringUtils.defaultString(request.getDescription()))
                .durationMinutes(requireDuration(request.getDurationMinutes()))
                .build());
        log.info("Created service {} ({}, {} min)", saved.getId(), saved.getName(), saved.getDurationMinutes());
        return saved;
    }

    @Transactional
    public ClinicService update(Long id, ClinicServiceRequest request) {
        ClinicService service = require(id);
        if (request.getName() != null) {
            if (StringUtils.isBlank(request.getName())) {
                throw new IllegalArgumentException("name must not be blank");
            }
            service.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            service.setDescription(request.getDescription());
        }
        if (request.getDurationMinutes() != null) {
            service.setDurationMinutes(requireDuration(request.getDurationMinutes()));
        }
        if (request.getActive() != null) {
            service.setActive(request.getActive());
        }
        log.info("Updated service {}", id);
        return serviceRepository.save(service);
    }

    @Transactional
    public void delete(Long id) {
        ClinicService service = require(id);
        if (appointmentRepository.existsByServiceId(id)) {
            throw new IllegalArgumentException(HAS_APPOINTMENTS);
        }
        serviceRepository.delete(service);
        log.info("Deleted service {} ({})", id, service.getName());
    }

    /**
     * Sort order becomes the position in {@code ids}. Unknown ids are skipped.
     */
    @Transactional
    public void reorder(List<Long> ids) {
        Map<Long, ClinicService> byId = serviceRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(ClinicService::getId, Function.identity()));
        for (int i = 0; i < ids.size(); i++) {
            ClinicService service = byId.get(ids.get(i));
            if (service != null) {
                service.setSortOrder(i);
            }
        }
        serviceRepository.saveAll(byId.values());
    }

    private static int requireDuration(int minutes) {
        if (minutes < 1) {
            throw new IllegalArgumentException("durationMinutes must be 1 or more");
        }
        return minutes;
    }

    private ClinicService require(Long id) {
        return serviceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Service not found: " + id));
    }
}
