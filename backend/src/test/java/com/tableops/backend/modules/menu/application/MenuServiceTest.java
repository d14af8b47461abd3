package com.tableops.backend.modules.menu.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.modules.access.application.AccessControlService;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.menu.domain.MenuCategory;
import com.tableops.backend.modules.menu.domain.MenuItem;
import com.tableops.backend.modules.menu.infrastructure.persistence.MenuItemRepository;
import com.tableops.backend.modules.menu.presentation.dto.CreateMenuItemRequest;
import com.tableops.backend.modules.menu.presentation.dto.MenuItemResponse;
import com.tableops.backend.modules.menu.presentation.dto.UpdateMenuItemRequest;
import com.tableops.backend.support.TestPrincipals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MenuServiceTest {

    @Mock
    private MenuItemRepository menuItemRepository;

    private MenuService menuService;

    @BeforeEach
    void setUp() {
        menuService = new MenuService(menuItemRepository, new AccessControlService());
    }

    @AfterEach
    void tearDown() {
        TestPrincipals.clear();
    }

    @Test
    void ownerCreatesMenuItemWithCleanAllergens() {
        TestPrincipals.authenticate(StaffRole.OWNER);
        when(menuItemRepository.existsByNameIgnoreCase("Bibimbap")).thenReturn(false);
        when(menuItemRepository.save(any(MenuItem.class))).thenAnswer(invocation -> {
            MenuItem item = invocation.getArgument(0);
            ReflectionTestUtils.setField(item, "id", UUID.randomUUID());
            return item;
        });

        MenuItemResponse response = menuService.createMenuItem(new CreateMenuItemRequest(
                " Bibimbap ", "Rice bowl", new BigDecimal("12.50"), MenuCategory.MAIN_COURSE,
                null, 15, List.of(" egg ", "sesame", "egg", " "), null));

        assertThat(response.id()).isNotNull();
        assertThat(response.name()).isEqualTo("Bibimbap");
        assertThat(response.available()).isTrue();
        assertThat(response.prepTime()).isEqualTo(15);
        assertThat(response.allergens()).containsExactly("egg", "sesame");
    }

    @Test
    @DisplayName("managers can read the menu but not change it")
    void managerCannotCreateMenuItem() {
        TestPrincipals.authenticate(StaffRole.MANAGER);

        assertThatThrownBy(() -> menuService.createMenuItem(new CreateMenuItemRequest(
                "Soup", "Hot", BigDecimal.ONE, MenuCategory.APPETIZER, true, 5, List.of(), null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("access.forbidden");
                });
        verifyNoInteractions(menuItemRepository);
    }

    @Test
    void duplicateNameIsConflict() {
        TestPrincipals.authenticate(StaffRole.OWNER);
        when(menuItemRepository.existsByNameIgnoreCase("Soup")).thenReturn(true);

        assertThatThrownBy(() -> menuService.createMenuItem(new CreateMenuItemRequest(
                "Soup", "Hot", BigDecimal.ONE, MenuCategory.APPETIZER, true, 5, List.of(), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("menu.duplicate_name"));
        verify(menuItemRepository, never()).save(any());
    }

    @Test
    void updateOnlyTouchesProvidedFields() {
        TestPrincipals.authenticate(StaffRole.OWNER);
        MenuItem item = existing("Kimchi Stew", "9.00");
        when(menuItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
        when(menuItemRepository.save(item)).thenReturn(item);

        MenuItemResponse response = menuService.updateMenuItem(item.getId(),
                new UpdateMenuItemRequest(null, null, new BigDecimal("9.50"), null, null, null, null, null));

        assertThat(response.name()).isEqualTo("Kimchi Stew");
        assertThat(response.price()).isEqualByComparingTo("9.50");
        assertThat(response.category()).isEqualTo(MenuCategory.MAIN_COURSE);
        assertThat(response.prepTime()).isEqualTo(20);
    }

    @Test
    void toggleAvailabilityFlipsFlag() {
        TestPrincipals.authenticate(StaffRole.OWNER);
        MenuItem item = existing("Mandu", "6.00");
        when(menuItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
        when(menuItemRepository.save(item)).thenReturn(item);

        assertThat(menuService.toggleAvailability(item.getId()).available()).isFalse();
        assertThat(menuService.toggleAvailability(item.getId()).available()).isTrue();
    }

    @Test
    void missingItemIsNotFound() {
        UUID id = UUID.randomUUID();
        when(menuItemRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> menuService.getMenuItem(id))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("menu.not_found");
                });
    }

    @Test
    void ownerDeletesMenuItem() {
        TestPrincipals.authenticate(StaffRole.OWNER);
        MenuItem item = existing("Tteokbokki", "8.00");
        when(menuItemRepository.findById(item.getId())).thenReturn(Optional.of(item));

        menuService.deleteMenuItem(item.getId());

        verify(menuItemRepository).delete(item);
    }

    private static MenuItem existing(String name, String price) {
        MenuItem item = new MenuItem();
        ReflectionTestUtils.setField(item, "id", UUID.randomUUID());
        item.setName(name);
        item.setDescription(name + " description");
        item.setPrice(new BigDecimal(price));
        item.setCategory(MenuCategory.MAIN_COURSE);
        item.setPreparationMinutes(20);
        return item;
    }
}
