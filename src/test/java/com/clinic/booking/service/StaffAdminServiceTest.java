package com.clinic.booking.service;

import com.clinic.booking.dto.StaffRequest;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.StaffRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StaffAdminServiceTest {

    private StaffRepository staffRepository;
    private StaffAdminService service;

    @BeforeEach
    void setUp() {
        staffRepository = Mockito.mock(StaffRepository.class);
        service = new StaffAdminService(staffRepository);
        when(staffRepository.save(any(Staff.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createTrimsNameAndDropsBlankTitle() {
        Staff saved = service.create(new StaffRequest(" Tanaka ", "  "));

        assertThat(saved.getName()).isEqualTo("Tanaka");
        assertThat(saved.getTitle()).isNull();
        assertThat(saved.isActive()).isTrue();
    }

    @Test
    void deleteOnlyDeactivates() {
        Staff tanaka = Staff.builder().id(4L).name("Tanaka").build();
        when(staffRepository.findById(4L)).thenReturn(Optional.of(tanaka));

        service.deactivate(4L);

        assertThat(tanaka.isActive()).isFalse();
        verify(staffRepository).save(tanaka);
        verify(staffRepository, never()).delete(any());
    }

    @Test
    void unknownStaffIsNotFound() {
        when(staffRepository.findById(4L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deactivate(4L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void reorderUsesListPosition() {
        Staff a = Staff.builder().id(1L).name("A").build();
        Staff b = Staff.builder().id(2L).name("B").build();
        when(staffRepository.findAllById(List.of(2L, 1L))).thenReturn(List.of(a, b));

        service.reorder(List.of(2L, 1L));

        assertThat(b.getSortOrder()).isZero();
        assertThat(a.getSortOrder()).isEqualTo(1);
    }
}
