package com.clinic.booking.service;

import com.clinic.booking.dto.StaffRequest;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.StaffRepository;
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
 * Admin maintenance of the staff list. Deleting only deactivates, so existing
 * appointments keep their staff.
 */
@Service
public class StaffAdminService {

    private static final Logger log = LoggerFactory.getLogger(StaffAdminService.class);

    private final StaffRepository staffRepository;

    public StaffAdminService(StaffRepository staffRepository) {
        this.staffRepository = staffRepository;
    }

    @Transactional(readOnly = true)
    public List<Staff> list() {
        return staffRepository.findByActiveTrueOrderBySortOrderAscIdAsc();
    }

    @Transactional
    public Staff create(StaffRequest request) {
        Staff saved = staffRepository.save(Staff.builder()
                .name(request.getName().trim())
                .title(StringUtils.trimToNull(request.getTitle()))
                .build());
        log.info("Created staff {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public void deactivate(Long id) {
        Staff staff = staffRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Staff not found: " + id));
        staff.setActive(false);
        staffRepository.save(staff);
        log.info("Deactivated staff {} ({})", id, staff.getName());
    }

    /**
     * Sort order becomes the position in {@code ids}. Unknown ids are skipped.
     */
    @Transactional
    public void reorder(List<Long> ids) {
        Map<Long, Staff> byId = staffRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Staff::getId, Function.identity()));
        for (int i = 0; i < ids.size(); i++) {
            Staff staff = byId.get(ids.get(i));
            if (staff != null) {
                staff.setSortOrder(i);
            }
        }
        staffRepository.saveAll(byId.values());
    }
}
