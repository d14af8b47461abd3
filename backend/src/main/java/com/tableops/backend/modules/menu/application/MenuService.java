package com.tableops.backend.modules.menu.application;

import java.util.List;
import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.global.security.JwtAuthenticationPrincipal;
import com.tableops.backend.modules.access.application.AccessControlService;
import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.menu.domain.MenuCategory;
import com.tableops.backend.modules.menu.domain.MenuItem;
import com.tableops.backend.modules.menu.infrastructure.persistence.MenuItemRepository;
import com.tableops.backend.modules.menu.infrastructure.persistence.MenuItemSpecifications;
import com.tableops.backend.modules.menu.presentation.dto.CreateMenuItemRequest;
import com.tableops.backend.modules.menu.presentation.dto.MenuItemResponse;
import com.tableops.backend.modules.menu.presentation.dto.MenuListResponse;
import com.tableops.backend.modules.menu.presentation.dto.UpdateMenuItemRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MenuService {

    private static final Logger log = LoggerFactory.getLogger(MenuService.class);
    private static final Sort MENU_ORDER = Sort.by("category", "name");

    private final MenuItemRepository menuItemRepository;
    private final AccessControlService accessControlService;

    public MenuService(MenuItemRepository menuItemRepository, AccessControlService accessControlService) {
        this.menuItemRepository = menuItemRepository;
        this.accessControlService = accessControlService;
    }

    @Transactional(readOnly = true)
    public MenuListResponse listMenu(MenuCategory category, Boolean available, String search) {
        List<MenuItemResponse> items = menuItemRepository
                .findAll(MenuItemSpecifications.matching(category, available, search), MENU_ORDER)
                .stream()
                .map(MenuItemResponse::from)
                .toList();
        return MenuListResponse.of(items);
    }

    @Transactional(readOnly = true)
    public MenuItemResponse getMenuItem(UUID menuItemId) {
        return MenuItemResponse.from(loadMenuItem(menuItemId));
    }

    public MenuItemResponse createMenuItem(CreateMenuItemRequest request) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.MANAGE_MENU);
        String name = request.name().trim();
        if (menuItemRepository.existsByNameIgnoreCase(name)) {
            throw duplicateName(name);
        }

        MenuItem item = new MenuItem();
        item.setName(name);
        item.setDescription(request.description().trim());
        item.setPrice(request.price());
        item.setCategory(request.category());
        item.setAvailable(request.available() == null || request.available());
        item.setPreparationMinutes(request.prepTime());
        item.setAllergens(normalizeAllergens(request.allergens()));
        item.setImageUrl(request.imageUrl());

        MenuItem saved = menuItemRepository.save(item);
        log.info("menu item created: id={} name={} by={}", saved.getId(), saved.getName(), principal.userId());
        return MenuItemResponse.from(saved);
    }

    public MenuItemResponse updateMenuItem(UUID menuItemId, UpdateMenuItemRequest request) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.MANAGE_MENU);
        MenuItem item = loadMenuItem(menuItemId);

        if (request.name() != null) {
            String name = request.name().trim();
            if (menuItemRepository.existsByNameIgnoreCaseAndIdNot(name, item.getId())) {
                throw duplicateName(name);
            }
            item.setName(name);
        }
        if (request.description() != null) {
            item.setDescription(request.description().trim());
        }
        if (request.price() != null) {
            item.setPrice(request.price());
        }
        if (request.category() != null) {
            item.setCategory(request.category());
        }
        if (request.available() != null) {
            item.setAvailable(request.available());
        }
        if (request.prepTime() != null) {
            item.setPreparationMinutes(request.prepTime());
        }
        if (request.allergens() != null) {
            item.setAllergens(normalizeAllergens(request.allergens()));
        }
        if (request.imageUrl() != null) {
            item.setImageUrl(request.imageUrl().isBlank() ? null : request.imageUrl());
        }

        MenuItem saved = menuItemRepository.save(item);
        log.info("menu item updated: id={} by={}", saved.getId(), principal.userId());
        return MenuItemResponse.from(saved);
    }

    /**
     * Placed orders keep their own copy of name and price, so removing an item never rewrites history.
     */
    public void deleteMenuItem(UUID menuItemId) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.MANAGE_MENU);
        MenuItem item = loadMenuItem(menuItemId);
        menuItemRepository.delete(item);
        log.info("menu item deleted: id={} name={} by={}", item.getId(), item.getName(), principal.userId());
    }

    public MenuItemResponse toggleAvailability(UUID menuItemId) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.MANAGE_MENU);
        MenuItem item = loadMenuItem(menuItemId);
        item.setAvailable(!item.isAvailable());
        MenuItem saved = menuItemRepository.save(item);
        log.info("menu item availability changed: id={} available={} by={}",
                saved.getId(), saved.isAvailable(), principal.userId());
        return MenuItemResponse.from(saved);
    }

    private MenuItem loadMenuItem(UUID menuItemId) {
        return menuItemRepository.findById(menuItemId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "menu.not_found",
                        "Menu item " + menuItemId + " does not exist"));
    }

    private List<String> normalizeAllergens(List<String> allergens) {
        if (allergens == null) {
            return List.of();
        }
        return allergens.stream()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
    }

    private ProblemException duplicateName(String name) {
        return new ProblemException(HttpStatus.CONFLICT, "menu.duplicate_name",
                "A menu item named '" + name + "' already exists");
    }
}
