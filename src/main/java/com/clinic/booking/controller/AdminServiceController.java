package com.clinic.booking.controller;

import com.clinic.booking.dto.ClinicServiceRequest;
import com.clinic.booking.dto.ReorderRequest;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.service.ClinicServiceAdminService;
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

/**
 * Treatment menu maintenance.
 */
@RestController
@RequestMapping("/api/admin/services")
public class AdminServiceController {

    private final ClinicServiceAdminService serviceAdminService;

    public AdminServiceController(ClinicServiceAdminService serviceAdminService) {
        this.serviceAdminService = serviceAdminService;
    }

    @GetMapping
    public List<ClinicService> list() {
        return serviceAdminService.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ClinicService create(@Valid @RequestBody ClinicServiceRequest request) {
        return serviceAdminService.create(request);
    }

    @PutMapping("/reorder")
    public Map<String, Object> reorder(@Valid @RequestBody ReorderRequest request) {
        serviceAdminService.reorder(request.getIds());
        return Map.of("success", true);
    }

    @PutMapping("/{id}")
    public ClinicService update(@PathVariable Long id, @Valid @RequestBody ClinicServiceRequest request) {
        return serviceAdminService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id) {
        serviceAdminService.delete(id);
        return Map.of("success", true);
    }
}
