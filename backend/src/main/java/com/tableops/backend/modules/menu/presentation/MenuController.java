package com.tableops.backend.modules.menu.presentation;

import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.modules.menu.application.MenuService;
import com.tableops.backend.modules.menu.domain.MenuCategory;
import com.tableops.backend.modules.menu.presentation.dto.CreateMenuItemRequest;
import com.tableops.backend.modules.menu.presentation.dto.MenuItemResponse;
import com.tableops.backend.modules.menu.presentation.dto.MenuListResponse;
import com.tableops.backend.modules.menu.presentation.dto.UpdateMenuItemRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/menu")
public class MenuController {

    private final MenuService menuService;

    public MenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @Operation(summary = "List menu items", description = "Public. Optional filters on category, availability and name.")
    @GetMapping
    public ResponseEntity<MenuListResponse> listMenu(
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "available", required = false) Boolean available,
            @RequestParam(name = "search", required = false) String search
    ) {
        return ResponseEntity.ok(menuService.listMenu(parseCategory(category), available, search));
    }

    @Operation(summary = "Get a menu item")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No such menu item")
    })
    @GetMapping("/{menuItemId}")
    public ResponseEntity<MenuItemResponse> getMenuItem(@PathVariable("menuItemId") UUID menuItemId) {
        return ResponseEntity.ok(menuService.getMenuItem(menuItemId));
    }

    @Operation(summary = "Create a menu item", description = "Requires MANAGE_MENU.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "403", description = "MANAGE_MENU required"),
            @ApiResponse(responseCode = "409", description = "Name already used")
    })
    @PostMapping
    public ResponseEntity<MenuItemResponse> createMenuItem(@Valid @RequestBody CreateMenuItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(menuService.createMenuItem(request));
    }

    @Operation(summary = "Update a menu item", description = "Requires MANAGE_MENU. Absent fields are kept.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "MANAGE_MENU required"),
            @ApiResponse(responseCode = "404", description = "No such menu item"),
            @ApiResponse(responseCode = "409", description = "Name already used")
    })
    @PutMapping("/{menuItemId}")
    public ResponseEntity<MenuItemResponse> updateMenuItem(
            @PathVariable("menuItemId") UUID menuItemId,
            @Valid @RequestBody UpdateMenuItemRequest request
    ) {
        return ResponseEntity.ok(menuService.updateMenuItem(menuItemId, request));
    }

    @Operation(summary = "Delete a menu item", description = "Requires MANAGE_MENU. Placed orders are unaffected.")
    @DeleteMapping("/{menuItemId}")
    public ResponseEntity<Void> deleteMenuItem(@PathVariable("menuItemId") UUID menuItemId) {
        menuService.deleteMenuItem(menuItemId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Toggle availability", description = "Requires MANAGE_MENU.")
    @PatchMapping("/{menuItemId}/availability")
    public ResponseEntity<MenuItemResponse> toggleAvailability(@PathVariable("menuItemId") UUID menuItemId) {
        return ResponseEntity.ok(menuService.toggleAvailability(menuItemId));
    }

    private MenuCategory parseCategory(String category) {
        if (category == null || category.isBlank()) {
            return null;
        }
        try {
            return MenuCategory.fromCode(category);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "menu.invalid_category", ex.getMessage());
        }
    }
}
