package com.clinic.booking.controller;

import com.clinic.booking.dto.ReorderRequest;
import com.clinic.booking.dto.StaffRequest;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.service.StaffAdminService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/staff")
public class AdminStaffController {

    private final StaffAdminService staffAdminService;

    public AdminStaffController(StaffAdminService staffAdminService) {
        this.staffAdminService = staffAdminService;
    }

    @GetMapping
    public List<Staff> list() {
        return staffAdminService.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Staff create(@Valid @RequestBody StaffRequest request) {
        return staffAdminService.create(request);
    }

    @PutMapping("/reorder")
    public Map<String, Object> reorder(@Valid @RequestBody ReorderRequest request) {
        staffAdminService.reorder(request.getIds());
        return Map.of("success", true);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id) {
        staffAdminService.deactivate(id);
        return Map.of("success", true);
    }
}
