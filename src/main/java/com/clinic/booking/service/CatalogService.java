package com.clinic.booking.service;

import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.repository.ClinicServiceRepository;
import com.clinic.booking.repository.StaffRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class CatalogService {

    private final ClinicServiceRepository serviceRepository;
    private final StaffRepository staffRepository;

    public CatalogService(ClinicServiceRepository serviceRepository, StaffRepository staffRepository) {
        this.serviceRepository = serviceRepository;
        this.staffRepository = staffRepository;
    }

    @Transactional(readOnly = true)
    public List<ClinicService> getActiveServices() {
        return serviceRepository.findByActiveTrueOrderBySortOrderAscIdAsc();
    }

    @Transactional(readOnly = true)
    public List<Staff> getActiveStaff() {
        return staffRepository.findByActiveTrueOrderBySortOrderAscIdAsc();
    }
}
